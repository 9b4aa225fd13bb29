package com.github.tarcv.binexp;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Node of the tree built by {@link RegexParser} and consumed by {@link RegexCompile}.
 */
final class RegexNode {
    enum Type {
        /** A single symbol, {@link #ch}. */
        ONE,
        /** A symbol from {@link #set}. */
        SET,
        /** A literal run of symbols, {@link #str}. */
        MULTI,
        /** Matches the empty string. */
        EMPTY,
        CONCATENATE,
        ALTERNATE,
        /** {@link #min} to {@link #max} repetitions of the only child. */
        LOOP,
        /** Parentheses. Only the whole match is reported, so a group is plain grouping. */
        GROUP,
        /** Positive lookahead. */
        REQUIRE,
        /** Negative lookahead. */
        PREVENT,
        /** Atomic group. */
        ATOMIC,
        /** ^ */
        BOL,
        /** $ */
        EOL,
        /** \A */
        BEGINNING,
        /** \z */
        END,
        /** \Z */
        ENDZ,
        /** \b */
        BOUNDARY,
        /** \B */
        NONBOUNDARY
    }

    static final int INFINITE = -1;

    final Type type;
    final List<RegexNode> children = new ArrayList<>();

    int ch;
    CharSet set;
    int[] str;
    int min;
    int max;
    boolean lazy;

    /** Case-insensitive symbol comparison for ONE, SET and MULTI. */
    boolean ignoreCase;
    /** Line-aware ^ and $. */
    boolean multiline;
    /** ECMAScript word characters for \b and \B. */
    boolean ecma;

    RegexNode(final Type type) {
        this.type = type;
    }

    static RegexNode one(final int ch, final boolean ignoreCase) {
        RegexNode node = new RegexNode(Type.ONE);
        node.ch = ch;
        node.ignoreCase = ignoreCase;
        return node;
    }

    static RegexNode set(final CharSet set, final boolean ignoreCase) {
        RegexNode node = new RegexNode(Type.SET);
        node.set = set;
        node.ignoreCase = ignoreCase;
        return node;
    }

    static RegexNode loop(final RegexNode child, final int min, final int max, final boolean lazy) {
        RegexNode node = new RegexNode(Type.LOOP);
        node.children.add(child);
        node.min = min;
        node.max = max;
        node.lazy = lazy;
        return node;
    }

    static RegexNode withChild(final Type type, final RegexNode child) {
        RegexNode node = new RegexNode(type);
        node.children.add(child);
        return node;
    }

    RegexNode child(final int i) {
        return children.get(i);
    }

    List<RegexNode> children() {
        return Collections.unmodifiableList(children);
    }

    /**
     * Collapses single-child concatenations and alternations and merges adjacent
     * case-matching literals into MULTI runs.
     */
    RegexNode reduce() {
        for (int i = 0; i < children.size(); i++) {
            children.set(i, children.get(i).reduce());
        }
        switch (type) {
            case CONCATENATE:
                mergeLiterals();
                if (children.isEmpty()) {
                    return new RegexNode(Type.EMPTY);
                }
                if (children.size() == 1) {
                    return children.get(0);
                }
                return this;
            case ALTERNATE:
                if (children.size() == 1) {
                    return children.get(0);
                }
                return this;
            case GROUP:
                return children.get(0);
            default:
                return this;
        }
    }

    private void mergeLiterals() {
        List<RegexNode> merged = new ArrayList<>();
        for (RegexNode node : children) {
            if (node.type == Type.EMPTY) {
                continue;
            }
            RegexNode prev = merged.isEmpty() ? null : merged.get(merged.size() - 1);
            if (prev != null && isLiteral(node) && isLiteral(prev) && prev.ignoreCase == node.ignoreCase) {
                RegexNode multi = new RegexNode(Type.MULTI);
                multi.ignoreCase = node.ignoreCase;
                int[] left = literalOf(prev);
                int[] right = literalOf(node);
                multi.str = Arrays.copyOf(left, left.length + right.length);
                System.arraycopy(right, 0, multi.str, left.length, right.length);
                merged.set(merged.size() - 1, multi);
            } else {
                merged.add(node);
            }
        }
        children.clear();
        children.addAll(merged);
    }

    private static boolean isLiteral(final RegexNode node) {
        return node.type == Type.ONE || node.type == Type.MULTI;
    }

    private static int[] literalOf(final RegexNode node) {
        return node.type == Type.ONE ? new int[]{node.ch} : node.str;
    }

    /**
     * Shortest number of symbols any match of this node consumes.
     * Saturates at {@link Integer#MAX_VALUE}.
     */
    int minLength() {
        switch (type) {
            case ONE:
            case SET:
                return 1;
            case MULTI:
                return str.length;
            case CONCATENATE: {
                long total = 0;
                for (RegexNode child : children) {
                    total += child.minLength();
                }
                return (int) Math.min(total, Integer.MAX_VALUE);
            }
            case ALTERNATE: {
                int result = Integer.MAX_VALUE;
                for (RegexNode child : children) {
                    result = Math.min(result, child.minLength());
                }
                return result;
            }
            case LOOP:
                return (int) Math.min((long) min * child(0).minLength(), Integer.MAX_VALUE);
            case GROUP:
            case ATOMIC:
                return child(0).minLength();
            default:
                return 0;
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(type.name());
        switch (type) {
            case ONE:
                sb.append(' ').append(CharSet.charDescription(ch));
                break;
            case SET:
                sb.append(' ').append(set);
                break;
            case MULTI:
                sb.append(" \"").append(new String(str, 0, str.length)).append('"');
                break;
            case LOOP:
                sb.append(" {").append(min).append(',').append(max == INFINITE ? "inf" : String.valueOf(max))
                        .append(lazy ? "}?" : "}");
                break;
            default:
                break;
        }
        if (!children.isEmpty()) {
            sb.append(children);
        }
        return sb.toString();
    }
}
