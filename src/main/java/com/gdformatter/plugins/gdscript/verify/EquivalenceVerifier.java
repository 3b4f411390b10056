package com.gdformatter.plugins.gdscript.verify;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.gdformatter.plugins.gdscript.parser.NodeKind;
import com.gdformatter.plugins.gdscript.parser.SyntaxNode;
import com.gdformatter.plugins.gdscript.parser.SyntaxTree;

/**
 * Structural comparison of two GDScript syntax trees.
 * <p>
 * Two trees are equivalent when they have the same shape of named nodes, the same
 * text for every value leaf and the same operator and keyword tokens. Whitespace,
 * indentation, comments and punctuation are ignored.
 */
public final class EquivalenceVerifier {

    private EquivalenceVerifier() {
    }

    public static EquivalenceResult compare(SyntaxTree a, SyntaxTree b) {
        return compare(a.getRoot(), a.getSource(), b.getRoot(), b.getSource());
    }

    /**
     * Walks both trees in parallel and reports the first difference found.
     *
     * @param textA source text {@code a} was parsed from
     * @param textB source text {@code b} was parsed from
     */
    public static EquivalenceResult compare(SyntaxNode a, String textA, SyntaxNode b, String textB) {
        return _compare(a, textA, b, textB, "");
    }

    /**
     * Compares two trees while treating the members of the file and of every class body
     * as an unordered collection. Used to confirm that reordering only moved members.
     */
    public static EquivalenceResult compareMembers(SyntaxTree a, SyntaxTree b) {
        List<SyntaxNode> membersA = a.getRoot().getNamedChildren();
        List<SyntaxNode> membersB = b.getRoot().getNamedChildren();
        if (membersA.size() != membersB.size()) {
            return EquivalenceResult.different("",
                    "member count differs: " + membersA.size() + " vs " + membersB.size());
        }

        Map<String, Integer> remaining = new HashMap<>();
        for (SyntaxNode member : membersB) {
            remaining.merge(_canonical(member, b.getSource()), 1, Integer::sum);
        }
        for (int i = 0; i < membersA.size(); i++) {
            SyntaxNode member = membersA.get(i);
            String key = _canonical(member, a.getSource());
            Integer count = remaining.get(key);
            if (count == null || count == 0) {
                return EquivalenceResult.different(_segment("", member, i),
                        "member has no counterpart after reordering");
            }
            remaining.put(key, count - 1);
        }
        return EquivalenceResult.equivalent();
    }

    private static EquivalenceResult _compare(SyntaxNode a, String textA, SyntaxNode b, String textB,
                                              String path) {
        if (a.getKind() != b.getKind()) {
            return EquivalenceResult.different(path,
                    "node kind differs: '" + a.getKind() + "' vs '" + b.getKind() + "'");
        }

        List<SyntaxNode> namedA = a.getNamedChildren();
        List<SyntaxNode> namedB = b.getNamedChildren();

        if (namedA.isEmpty() && a.getKind().isValueKind()) {
            String valueA = _slice(a, textA);
            String valueB = _slice(b, textB);
            if (!valueA.equals(valueB)) {
                return EquivalenceResult.different(path,
                        a.getKind() + " value differs: '" + valueA + "' vs '" + valueB + "'");
            }
        }

        List<String> tokensA = _significantTokens(a, textA);
        List<String> tokensB = _significantTokens(b, textB);
        if (!tokensA.equals(tokensB)) {
            return EquivalenceResult.different(path, _tokenDifference(tokensA, tokensB));
        }

        if (namedA.size() != namedB.size()) {
            return EquivalenceResult.different(path,
                    "named child count differs: " + namedA.size() + " vs " + namedB.size());
        }

        for (int i = 0; i < namedA.size(); i++) {
            SyntaxNode childA = namedA.get(i);
            EquivalenceResult result = _compare(childA, textA, namedB.get(i), textB,
                    _segment(path, childA, i));
            if (!result.isEquivalent()) {
                return result;
            }
        }
        return EquivalenceResult.equivalent();
    }

    private static String _tokenDifference(List<String> tokensA, List<String> tokensB) {
        int shared = Math.min(tokensA.size(), tokensB.size());
        for (int i = 0; i < shared; i++) {
            if (!tokensA.get(i).equals(tokensB.get(i))) {
                return "token differs: '" + tokensA.get(i) + "' vs '" + tokensB.get(i) + "'";
            }
        }
        return "token count differs: " + tokensA.size() + " vs " + tokensB.size();
    }

    /**
     * Anonymous operator and keyword tokens directly under {@code node}.
     */
    private static List<String> _significantTokens(SyntaxNode node, String text) {
        List<String> tokens = new ArrayList<>();
        for (SyntaxNode child : node.getChildren()) {
            if (child.is(NodeKind.TOKEN) && !child.getTokenType().isPunctuation()) {
                tokens.add(_slice(child, text));
            }
        }
        return tokens;
    }

    private static String _canonical(SyntaxNode node, String text) {
        StringBuilder out = new StringBuilder();
        _appendCanonical(node, text, false, out);
        return out.toString();
    }

    private static void _appendCanonical(SyntaxNode node, String text, boolean unordered, StringBuilder out) {
        out.append('(').append(node.getKind());
        List<SyntaxNode> named = node.getNamedChildren();
        if (named.isEmpty() && node.getKind().isValueKind()) {
            out.append(' ').append(_quote(_slice(node, text)));
        }
        for (String token : _significantTokens(node, text)) {
            out.append(' ').append(_quote(token));
        }

        List<String> children = new ArrayList<>();
        SyntaxNode classBody = node.is(NodeKind.CLASS_DEFINITION) ? node.field("body") : null;
        for (SyntaxNode child : named) {
            StringBuilder nested = new StringBuilder();
            _appendCanonical(child, text, child == classBody, nested);
            children.add(nested.toString());
        }
        if (unordered) {
            Collections.sort(children);
        }
        for (String child : children) {
            out.append(' ').append(child);
        }
        out.append(')');
    }

    private static String _quote(String value) {
        return '"' + value.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }

    private static String _slice(SyntaxNode node, String text) {
        return text.substring(node.getStartOffset(), node.getEndOffset());
    }

    private static String _segment(String path, SyntaxNode node, int index) {
        String segment = node.getKind() + "[" + index + "]";
        return path.isEmpty() ? segment : path + "." + segment;
    }
}
