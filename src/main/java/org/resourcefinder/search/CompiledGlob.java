package org.resourcefinder.search;

import java.util.ArrayList;
import java.util.List;

/**
 * 编译后的路径 glob：多个候选（alternative）之间是 OR 关系。
 * <p>
 * 每个候选是一组按 {@code /} 切分的段匹配器：
 * <ul>
 *   <li>{@code **}：匹配 0 个或多个完整路径段（{@code a/**&#47;b} 可以匹配 {@code a/b}）。</li>
 *   <li>含 {@code *} / {@code ?} 的段：只在单个路径段内匹配，不会跨越 {@code /}。</li>
 *   <li>其它段：字面量精确匹配（区分大小写）。</li>
 * </ul>
 * 不含 {@code /} 的“裸”候选（例如 {@code file2.js}、{@code *.ts}）匹配任意深度下的文件名。
 * <p>
 * 匹配采用按段回溯的算法，而不是翻译成单个正则，因此同一个候选里出现多个 {@code **} 时也能尝试所有切分点。
 */
public final class CompiledGlob {

    private static final String GLOBSTAR = "**";

    private static final CompiledGlob NOTHING = new CompiledGlob("", List.of());

    private final String source;
    private final List<Alternative> alternatives;

    CompiledGlob(String source, List<Alternative> alternatives) {
        this.source = source;
        this.alternatives = List.copyOf(alternatives);
    }

    static CompiledGlob nothing() {
        return NOTHING;
    }

    public boolean isEmpty() {
        return alternatives.isEmpty();
    }

    int alternativeCount() {
        return alternatives.size();
    }

    /**
     * 判断相对路径（/ 分隔）是否匹配任一候选。
     */
    public boolean matches(String relativePath) {
        if (relativePath == null || relativePath.isEmpty() || alternatives.isEmpty()) {
            return false;
        }
        String[] pathSegments = splitPath(relativePath);
        for (Alternative alternative : alternatives) {
            if (alternative.matches(relativePath, pathSegments)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 目录剪枝判断：该目录下是否“可能”存在匹配的文件。
     * <p>
     * 结果是保守的：返回 false 时子树一定没有匹配；返回 true 不代表一定有匹配。
     */
    public boolean couldMatchUnder(String relativeDirectory) {
        if (alternatives.isEmpty()) {
            return false;
        }
        if (relativeDirectory == null || relativeDirectory.isEmpty()) {
            return true;
        }
        String[] dirSegments = splitPath(relativeDirectory);
        for (Alternative alternative : alternatives) {
            if (alternative.couldMatchUnder(dirSegments)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "CompiledGlob[" + source + "]";
    }

    private static String[] splitPath(String path) {
        List<String> segments = new ArrayList<>();
        for (String segment : path.split("/")) {
            if (!segment.isEmpty()) {
                segments.add(segment);
            }
        }
        return segments.toArray(new String[0]);
    }

    /**
     * 段内通配匹配：{@code *} 匹配任意个字符，{@code ?} 匹配一个字符（经典的贪婪 + 回退算法）。
     */
    static boolean matchSegment(String pattern, String text) {
        int p = 0;
        int t = 0;
        int starP = -1;
        int starT = -1;
        while (t < text.length()) {
            if (p < pattern.length() && (pattern.charAt(p) == '?' || pattern.charAt(p) == text.charAt(t))) {
                p++;
                t++;
            } else if (p < pattern.length() && pattern.charAt(p) == '*') {
                starP = p++;
                starT = t;
            } else if (starP >= 0) {
                p = starP + 1;
                t = ++starT;
            } else {
                return false;
            }
        }
        while (p < pattern.length() && pattern.charAt(p) == '*') {
            p++;
        }
        return p == pattern.length();
    }

    static boolean hasWildcard(String text) {
        return text.indexOf('*') >= 0 || text.indexOf('?') >= 0;
    }

    /**
     * 单个候选。
     *
     * @param pattern  规范化后的候选文本
     * @param segments 按 / 切分后的段（非裸候选时使用）
     * @param bare     是否为裸候选（不含 /）
     * @param literal  是否按原样比较（不做任何通配解释）
     */
    record Alternative(String pattern, List<String> segments, boolean bare, boolean literal) {

        boolean matches(String relativePath, String[] pathSegments) {
            if (literal) {
                return relativePath.equals(pattern) || relativePath.endsWith("/" + pattern);
            }
            if (bare) {
                return matchesBare(relativePath, pathSegments);
            }
            String[] patternSegments = segments.toArray(new String[0]);
            Boolean[][] memo = new Boolean[patternSegments.length + 1][pathSegments.length + 1];
            return matchFrom(patternSegments, 0, pathSegments, 0, memo);
        }

        private boolean matchesBare(String relativePath, String[] pathSegments) {
            if (pathSegments.length == 0) {
                return false;
            }
            String fileName = pathSegments[pathSegments.length - 1];
            if (matchSegment(pattern, fileName)) {
                return true;
            }
            if (relativePath.endsWith("/" + pattern)) {
                return true;
            }
            return !hasWildcard(pattern) && relativePath.equals(pattern);
        }

        boolean couldMatchUnder(String[] dirSegments) {
            if (bare || literal) {
                return true;
            }
            return prefixFrom(segments.toArray(new String[0]), 0, dirSegments, 0);
        }

        private static boolean matchFrom(String[] pattern, int pi, String[] path, int si, Boolean[][] memo) {
            Boolean cached = memo[pi][si];
            if (cached != null) {
                return cached;
            }
            boolean result;
            if (pi == pattern.length) {
                result = (si == path.length);
            } else if (GLOBSTAR.equals(pattern[pi])) {
                // ** 先尝试匹配 0 段，再逐段吞掉路径（回溯所有切分点）
                result = matchFrom(pattern, pi + 1, path, si, memo)
                        || (si < path.length && matchFrom(pattern, pi, path, si + 1, memo));
            } else {
                result = si < path.length
                        && matchSegment(pattern[pi], path[si])
                        && matchFrom(pattern, pi + 1, path, si + 1, memo);
            }
            memo[pi][si] = result;
            return result;
        }

        private static boolean prefixFrom(String[] pattern, int pi, String[] dir, int di) {
            if (di == dir.length) {
                // 目录已经完全被消费：只要候选还剩下至少一段，就可能匹配其下的文件
                return pi < pattern.length;
            }
            if (pi == pattern.length) {
                return false;
            }
            if (GLOBSTAR.equals(pattern[pi])) {
                return prefixFrom(pattern, pi + 1, dir, di) || prefixFrom(pattern, pi, dir, di + 1);
            }
            return matchSegment(pattern[pi], dir[di]) && prefixFrom(pattern, pi + 1, dir, di + 1);
        }
    }
}
