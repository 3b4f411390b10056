package com.gdformatter.plugins.gdscript.format;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Puts comments back into rendered output and produces the final text.
 * <p>
 * The syntax tree carries no comments, so they are recovered from the
 * {@link CommentTable} and positioned by the source-line tags of the rendered
 * lines. A standalone comment lands in front of the first rendered line whose
 * tag follows it. An inline comment is appended, two spaces after the code,
 * to the first rendered line tagged with its source line.
 * <p>
 * When a policy blank line separates two statements, a comment block glued to
 * the previous statement stays with it (before the blank) if the source had a
 * blank line after the block, or if the block is indented deeper than the next
 * statement. Other blocks go after the blank lines, next to the statement that
 * follows them.
 */
public final class OutputAssembler {

    private OutputAssembler() {
    }

    public static FormattedOutput injectComments(FormattedOutput output, CommentTable comments, SourceText source) {
        return new Injection(output.getLines(), comments, source).run();
    }

    /**
     * Joins the lines with '\n' after dropping trailing blank lines, then adds
     * one final newline when the options ask for it and the text is not empty.
     */
    public static String renderFinal(FormattedOutput output, FormatOptions options) {
        List<FormattedLine> lines = output.getLines();
        int end = lines.size();
        while (end > 0 && lines.get(end - 1).isBlank()) {
            end--;
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < end; i++) {
            if (i > 0) {
                sb.append('\n');
            }
            sb.append(lines.get(i).getContent());
        }
        if (options.isTrailingNewline() && sb.length() > 0) {
            sb.append('\n');
        }
        return sb.toString();
    }

    private static final class Injection {
        private final List<FormattedLine> lines;
        private final CommentTable comments;
        private final SourceText source;
        private final Set<Integer> emitted = new HashSet<>();
        private final Set<Integer> consumedInline = new HashSet<>();
        private final FormattedOutput result = new FormattedOutput();
        private int lastSeen = 0;

        Injection(List<FormattedLine> lines, CommentTable comments, SourceText source) {
            this.lines = lines;
            this.comments = comments;
            this.source = source;
            for (FormattedLine line : lines) {
                if (line.isTagged()) {
                    for (int l = line.getSourceLine(); l <= line.getEndSourceLine(); l++) {
                        emitted.add(l);
                    }
                }
            }
        }

        FormattedOutput run() {
            for (int i = 0; i < lines.size(); i++) {
                FormattedLine line = lines.get(i);
                if (line.isTagged()) {
                    _emitLeadingComments(line.getSourceLine());
                    result.push(_withInlineComment(line));
                    lastSeen = Math.max(lastSeen, line.getEndSourceLine());
                } else {
                    _emitTrailingComments(i);
                    result.push(line);
                }
            }
            _emitLeadingComments(source.getLineCount() + 1);
            return result;
        }

        /**
         * Emits every pending comment block between the last seen line and
         * {@code target}, keeping one blank line wherever the source had any.
         */
        private void _emitLeadingComments(int target) {
            List<int[]> blocks = _commentBlocks(lastSeen + 1, target - 1);
            if (blocks.isEmpty()) {
                return;
            }
            int previousEnd = lastSeen;
            for (int[] block : blocks) {
                if (!result.isEmpty() && _hasBlankBetween(previousEnd, block[0])) {
                    _ensureTrailingBlank();
                }
                _emitBlock(block);
                previousEnd = block[1];
            }
            if (target <= source.getLineCount() && _hasBlankBetween(previousEnd, target)) {
                _ensureTrailingBlank();
            }
        }

        private void _emitTrailingComments(int blankIndex) {
            int next = _nextTaggedLine(blankIndex);
            List<int[]> blocks = _commentBlocks(lastSeen + 1, next - 1);
            if (blocks.isEmpty()) {
                return;
            }
            int[] first = blocks.get(0);
            if (first[0] != lastSeen + 1) {
                return;
            }
            boolean trailing = next > source.getLineCount()
                    || source.isBlank(first[1] + 1)
                    || _indentWidth(first[0]) > _indentWidth(next);
            if (trailing) {
                _emitBlock(first);
            }
        }

        private void _emitBlock(int[] block) {
            for (int l = block[0]; l <= block[1]; l++) {
                result.pushMapped(comments.getStandalone(l), l);
                emitted.add(l);
            }
            lastSeen = Math.max(lastSeen, block[1]);
        }

        private FormattedLine _withInlineComment(FormattedLine line) {
            int sourceLine = line.getSourceLine();
            String comment = comments.getInline(sourceLine);
            if (comment == null || !consumedInline.add(sourceLine)) {
                return line;
            }
            String content = line.getContent();
            if (content.stripTrailing().endsWith(comment)) {
                return line;
            }
            return line.withContent(content + "  " + comment);
        }

        // Source line of the next tagged line after an index, or one past the last source line.
        private int _nextTaggedLine(int fromIndex) {
            for (int j = fromIndex + 1; j < lines.size(); j++) {
                if (lines.get(j).isTagged()) {
                    return lines.get(j).getSourceLine();
                }
            }
            return source.getLineCount() + 1;
        }

        // Contiguous runs of standalone comment lines not yet emitted, as {start, end} pairs.
        private List<int[]> _commentBlocks(int from, int to) {
            List<int[]> blocks = new ArrayList<>();
            int[] current = null;
            for (int l = from; l <= to; l++) {
                if (comments.isStandalone(l) && !emitted.contains(l)) {
                    if (current != null && current[1] == l - 1) {
                        current[1] = l;
                    } else {
                        current = new int[] {l, l};
                        blocks.add(current);
                    }
                }
            }
            return blocks;
        }

        private boolean _hasBlankBetween(int after, int before) {
            for (int l = after + 1; l < before; l++) {
                if (source.isBlank(l)) {
                    return true;
                }
            }
            return false;
        }

        private void _ensureTrailingBlank() {
            if (result.trailingBlankCount() == 0) {
                result.push(FormattedLine.blank());
            }
        }

        private int _indentWidth(int lineNumber) {
            int width = 0;
            for (char c : source.getIndentation(lineNumber).toCharArray()) {
                width += c == '\t' ? 4 : 1;
            }
            return width;
        }
    }
}
