package org.resourcefinder.search;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 流式判断文件内容是否包含正则匹配，不会把整个文件读入内存。
 * <p>
 * 算法：
 * <ul>
 *   <li>按固定大小（{@link #DEFAULT_CHUNK_SIZE}）分块读取，并用严格 UTF-8 解码（跨块的多字节字符由解码器拼接）。</li>
 *   <li>保留上一块末尾的 {@code overlapSize} 个字符作为“衔接窗口”，与新块拼接后再执行正则，
 *       因此跨越读取边界的匹配不会丢失。</li>
 *   <li>一旦命中立即停止读取。</li>
 * </ul>
 * 能可靠跨边界识别的最长匹配约为 {@code overlapSize} 个字符；这是可调参数，不是硬性限制
 * （衔接窗口之外的更长匹配仍可能在单个块内被识别）。
 * <p>
 * 窗口被截断后会多保留一个前导字符并把它排除在匹配区域之外（透明边界 + 非锚定边界），
 * 这样 {@code ^}、{@code \b} 以及后顾断言在窗口起点看到的是真实的前一个字符。
 * 匹配过程读到了窗口末尾的命中（例如 {@code $}、否定前瞻）会推迟到读入下一块后再确认，
 * 前提是命中起点仍在衔接窗口内；更长的匹配不做推迟。
 * <p>
 * 支持的正则方言为 {@link java.util.regex}（支持前瞻/后顾、单词边界、反向引用）。
 */
public class StreamingContentSearcher {

    public static final int DEFAULT_CHUNK_SIZE = 64 * 1024;
    public static final int DEFAULT_OVERLAP_SIZE = 32 * 1024;

    static final String INVALID_REGEX_PREFIX = "Invalid regular expression: ";

    private final int chunkSize;
    private final int overlapSize;

    public StreamingContentSearcher() {
        this(DEFAULT_CHUNK_SIZE, DEFAULT_OVERLAP_SIZE);
    }

    /**
     * @param chunkSize   每次读取的字节数
     * @param overlapSize 衔接窗口保留的字符数
     */
    public StreamingContentSearcher(int chunkSize, int overlapSize) {
        if (chunkSize < 16) {
            throw new IllegalArgumentException("chunkSize 不能小于 16：" + chunkSize);
        }
        if (overlapSize < 0) {
            throw new IllegalArgumentException("overlapSize 不能为负数：" + overlapSize);
        }
        this.chunkSize = chunkSize;
        this.overlapSize = overlapSize;
    }

    /**
     * 编译内容正则：默认大小写不敏感，{@code ^}/{@code $} 按行匹配。
     *
     * @throws InvalidPatternException 正则不合法；消息以 {@code "Invalid regular expression: "} 开头，
     *                                 后面是正则引擎的原始诊断
     */
    public static Pattern compile(String source, boolean caseSensitive) {
        int flags = Pattern.MULTILINE;
        if (!caseSensitive) {
            flags |= Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
        }
        try {
            return Pattern.compile(source, flags);
        } catch (PatternSyntaxException e) {
            throw new InvalidPatternException(INVALID_REGEX_PREFIX + describe(e), e);
        }
    }

    private static String describe(PatternSyntaxException e) {
        String pattern = e.getPattern();
        return "/" + pattern + "/: " + e.getDescription()
                + (e.getIndex() >= 0 ? " near index " + e.getIndex() : "");
    }

    /**
     * 判断文件内容是否至少包含一处匹配。
     *
     * @throws CharacterCodingException 文件不是合法的 UTF-8 文本
     * @throws IOException              读取失败
     */
    public boolean containsMatch(Path file, Pattern pattern) throws IOException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);

        ByteBuffer bytes = ByteBuffer.allocate(chunkSize);
        CharBuffer chars = CharBuffer.allocate(chunkSize);
        StringBuilder window = new StringBuilder(Math.min(chunkSize + overlapSize + 1, 1 << 20));
        // 0：窗口从文件开头开始；1：窗口第一个字符只作为前导上下文
        int regionStart = 0;

        try (SeekableByteChannel channel = Files.newByteChannel(file)) {
            boolean eof = false;
            while (!eof) {
                int read = channel.read(bytes);
                eof = read < 0;
                bytes.flip();

                CoderResult result;
                do {
                    result = decoder.decode(bytes, chars, eof);
                    if (result.isError()) {
                        result.throwException();
                    }
                    drain(chars, window);
                } while (result.isOverflow());
                if (eof) {
                    result = decoder.flush(chars);
                    if (result.isError()) {
                        result.throwException();
                    }
                    drain(chars, window);
                }
                bytes.compact();

                if ((eof || window.length() > regionStart) && find(pattern, window, regionStart, eof, overlapSize)) {
                    return true;
                }

                int keep = overlapSize + 1;
                if (window.length() > keep) {
                    window.delete(0, window.length() - keep);
                    regionStart = 1;
                }
            }
        }
        return false;
    }

    private static void drain(CharBuffer chars, StringBuilder window) {
        chars.flip();
        if (chars.hasRemaining()) {
            window.append(chars);
        }
        chars.clear();
    }

    private static boolean find(Pattern pattern, CharSequence window, int regionStart, boolean eof, int overlapSize) {
        Matcher matcher = pattern.matcher(window);
        matcher.useTransparentBounds(true);
        matcher.useAnchoringBounds(false);
        matcher.region(regionStart, window.length());
        if (!matcher.find()) {
            return false;
        }
        if (eof) {
            return true;
        }
        // 命中依赖后续输入时（$、\b、读到窗口末尾的否定前瞻 foo(?!bar) 等），
        // 只要命中起点还会留在下一轮的衔接窗口里，就推迟到读入后续内容后重新判断
        boolean dependsOnMoreInput = matcher.requireEnd() || matcher.hitEnd();
        return !(dependsOnMoreInput && matcher.start() >= window.length() - overlapSize);
    }
}
