package com.gdformatter.plugins.gdscript.format;

import com.gdformatter.plugins.gdscript.parser.ParseException;
import com.gdformatter.plugins.gdscript.parser.SyntaxTree;
import com.gdformatter.util.LoggerUtil;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Entry point of the pretty-printer: parse, render, reinject comments, join.
 */
public final class Formatter {
    private static final Logger logger = LoggerUtil.getLogger(Formatter.class);

    private Formatter() {
    }

    /**
     * Formats GDScript source.
     *
     * @throws FormatException of kind {@link FormatException.Kind#PARSE} when the source does not parse
     */
    public static String format(String source, FormatOptions options) throws FormatException {
        return format(parse(source), options);
    }

    public static String format(SyntaxTree tree, FormatOptions options) {
        SourceText text = new SourceText(tree.getSource());
        CommentTable comments = CommentTable.extract(text);
        SkipRegions skipRegions = SkipRegions.parse(text);
        if (!skipRegions.isEmpty()) {
            logger.fine("Skip regions: " + skipRegions.getRegions());
        }

        RenderContext ctx = new RenderContext(text, comments, skipRegions, options);
        new NodeRenderer(ctx).renderSource(tree.getRoot());

        FormattedOutput output = OutputAssembler.injectComments(ctx.getOutput(), comments, text);
        return OutputAssembler.renderFinal(output, options);
    }

    public static SyntaxTree parse(String source) throws FormatException {
        try {
            return SyntaxTree.parse(source);
        } catch (ParseException e) {
            throw new FormatException(FormatException.Kind.PARSE, e.getMessage(), e.getLine(), e.getColumn(), e);
        }
    }

    /**
     * 1-based numbers of the lines wider than the configured maximum, counting
     * a tab as one indent width.
     */
    public static List<Integer> linesExceedingLength(String text, FormatOptions options) {
        List<Integer> result = new ArrayList<>();
        int tabWidth = options.getIndentStyle().width();
        List<String> lines = SourceText.splitLines(text);
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            int width = 0;
            for (int c = 0; c < line.length(); c++) {
                width += line.charAt(c) == '\t' ? tabWidth : 1;
            }
            if (width > options.getMaxLineLength()) {
                result.add(i + 1);
            }
        }
        return result;
    }
}
