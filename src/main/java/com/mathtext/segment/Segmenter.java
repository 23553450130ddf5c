package com.mathtext.segment;

import com.mathtext.lex.BraceGroups;
import com.mathtext.model.Segment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 将混合文本切分为有序的纯文本/数学片段。
 *
 * 扫描从左到右进行，不抛出异常：未闭合的定界符降级为数学片段，没有开标记的闭标记保留为文本。
 */
public class Segmenter {
    private static final Logger logger = LoggerFactory.getLogger(Segmenter.class);

    private final boolean lenientDollar;
    private final boolean mergeAdjacentMath;
    private final boolean foldNewlines;

    public Segmenter() {
        this(false, true, true);
    }

    /**
     * @param lenientDollar 未闭合的单个 $ 按普通文本处理（货币金额）
     * @param mergeAdjacentMath 合并只隔空白的相邻数学片段
     * @param foldNewlines 数学片段内的换行折叠为空格
     */
    public Segmenter(boolean lenientDollar, boolean mergeAdjacentMath, boolean foldNewlines) {
        this.lenientDollar = lenientDollar;
        this.mergeAdjacentMath = mergeAdjacentMath;
        this.foldNewlines = foldNewlines;
    }

    /**
     * 切分文本，空输入返回空列表。
     */
    public List<Segment> parse(String text) {
        return scan(text).segments();
    }

    /**
     * 切分文本并报告是否遇到了畸形定界符。
     */
    public SegmentScan scan(String text) {
        if (text == null || text.isEmpty()) {
            return new SegmentScan(List.of(), false);
        }

        List<Segment> segments = new ArrayList<>();
        StringBuilder plain = new StringBuilder();
        boolean malformed = false;
        int lastCloseEnd = -1;
        DelimiterPair lastClosed = null;
        int index = 0;

        while (index < text.length()) {
            char currentChar = text.charAt(index);

            if (currentChar == '\\' && index + 1 < text.length()) {
                char next = text.charAt(index + 1);
                if (next == '$' || next == '\\') {
                    plain.append(text, index, index + 2);
                    index += 2;
                    continue;
                }
                DelimiterPair strayClose = DelimiterPair.matchEscapedClose(text, index);
                if (strayClose != null) {
                    malformed = true;
                    if (index == lastCloseEnd && strayClose == lastClosed) {
                        logger.debug("丢弃位置{}处重复的闭标记 {}", index, strayClose.close());
                        lastCloseEnd = index + 2;
                    } else {
                        plain.append(text, index, index + 2);
                    }
                    index += 2;
                    continue;
                }
            }

            DelimiterPair pair = DelimiterPair.matchOpen(text, index);
            if (pair == null) {
                plain.append(currentChar);
                index++;
                continue;
            }

            int contentStart = index + pair.open().length();
            CloseMatch closeMatch = findClose(text, contentStart, pair);
            if (!closeMatch.closed() && pair == DelimiterPair.INLINE_DOLLAR && lenientDollar) {
                plain.append(currentChar);
                index++;
                continue;
            }

            flushPlain(plain, segments);
            segments.add(Segment.latex(text.substring(contentStart, closeMatch.contentEnd()), pair.displayMode()));
            if (closeMatch.closed()) {
                lastCloseEnd = closeMatch.next();
                lastClosed = pair;
            } else {
                malformed = true;
                lastCloseEnd = -1;
                lastClosed = null;
                logger.debug("位置{}处的 {} 未闭合，降级到位置{}", index, pair.open(), closeMatch.contentEnd());
            }
            index = closeMatch.next();
        }
        flushPlain(plain, segments);

        List<Segment> result = mergeAdjacentMath ? merge(segments) : segments;
        if (foldNewlines) {
            result = fold(result);
        }
        return new SegmentScan(result, malformed);
    }

    /**
     * 文本中是否至少含有一个数学片段。
     */
    public boolean containsLatex(String text) {
        return scan(text).latexCount() > 0;
    }

    /**
     * 去除首尾空白后是否恰好为一个数学片段。
     */
    public boolean isPureLatex(String text) {
        if (text == null) {
            return false;
        }
        List<Segment> segments = parse(text.trim());
        return segments.size() == 1 && segments.get(0).isLatex();
    }

    private record CloseMatch(int contentEnd, int next, boolean closed) {
    }

    /**
     * 从 from 开始寻找 pair 的闭标记；遇到同族开标记或输入结束时返回未闭合结果。
     */
    private CloseMatch findClose(String text, int from, DelimiterPair pair) {
        int index = from;
        while (index < text.length()) {
            char currentChar = text.charAt(index);
            if (currentChar == '\\') {
                if (pair.family() != DelimiterPair.Family.DOLLAR) {
                    if (text.startsWith(pair.close(), index)) {
                        return new CloseMatch(index, index + pair.close().length(), true);
                    }
                    if (text.startsWith(pair.open(), index)) {
                        return new CloseMatch(index, index, false);
                    }
                }
                index += BraceGroups.escapeWidth(text, index);
                continue;
            }
            if (currentChar == '$' && pair.family() == DelimiterPair.Family.DOLLAR) {
                if (pair == DelimiterPair.INLINE_DOLLAR) {
                    return new CloseMatch(index, index + 1, true);
                }
                if (text.startsWith(pair.close(), index)) {
                    return new CloseMatch(index, index + 2, true);
                }
            }
            index++;
        }
        return new CloseMatch(text.length(), text.length(), false);
    }

    private void flushPlain(StringBuilder plain, List<Segment> segments) {
        if (plain.length() > 0) {
            segments.add(Segment.plain(plain.toString()));
            plain.setLength(0);
        }
    }

    /**
     * 合并只隔空白或紧邻的数学片段，保留第一个片段的显示模式。
     */
    private List<Segment> merge(List<Segment> segments) {
        List<Segment> merged = new ArrayList<>();
        for (Segment segment : segments) {
            int size = merged.size();
            if (segment.isLatex() && size > 0) {
                Segment previous = merged.get(size - 1);
                if (previous.isLatex()) {
                    merged.set(size - 1, Segment.latex(previous.content() + " " + segment.content(), previous.isDisplayMode()));
                    continue;
                }
                if (previous.content().isBlank() && size > 1 && merged.get(size - 2).isLatex()) {
                    Segment head = merged.get(size - 2);
                    merged.remove(size - 1);
                    merged.set(size - 2, Segment.latex(
                        head.content() + previous.content() + segment.content(), head.isDisplayMode()));
                    continue;
                }
            }
            merged.add(segment);
        }
        return merged;
    }

    private List<Segment> fold(List<Segment> segments) {
        List<Segment> folded = new ArrayList<>(segments.size());
        for (Segment segment : segments) {
            if (segment.isLatex() && (segment.content().indexOf('\n') >= 0 || segment.content().indexOf('\r') >= 0)) {
                String content = segment.content().replace('\r', ' ').replace('\n', ' ');
                folded.add(Segment.latex(content, segment.isDisplayMode()));
            } else {
                folded.add(segment);
            }
        }
        return folded;
    }
}
