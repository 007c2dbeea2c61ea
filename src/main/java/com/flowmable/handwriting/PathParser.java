package com.flowmable.handwriting;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.StringTokenizer;

/**
 * Parses the subset of SVG path data used by glyph templates: absolute
 * {@code M x y}, {@code L x y} and {@code Q cx cy x y}, separated by spaces or
 * commas. A command letter may be followed by several coordinate groups; after
 * {@code M} the extra groups are line-tos.
 * <p>
 * The result is split into strokes, each starting with a move.
 */
final class PathParser {

    private static final String COMMANDS = "MLQ";

    private PathParser() {
    }

    static List<List<PathSegment>> parse(String data) {
        if (data == null || data.isBlank()) {
            throw new InvalidInputException("Path data is empty");
        }
        List<String> tokens = tokenize(data);
        List<List<PathSegment>> strokes = new ArrayList<>();
        List<PathSegment> current = null;
        char command = 0;
        int i = 0;
        while (i < tokens.size()) {
            String token = tokens.get(i);
            if (isCommand(token)) {
                command = token.charAt(0);
                i++;
            } else if (command == 0) {
                throw new InvalidInputException("Path data must start with a command: " + data);
            } else if (command == 'M') {
                command = 'L';
            }

            double[] p;
            switch (command) {
                case 'M':
                    p = numbers(tokens, i, 2, data);
                    current = new ArrayList<>();
                    current.add(PathSegment.moveTo(p[0], p[1]));
                    strokes.add(current);
                    i += 2;
                    break;
                case 'L':
                    requireStroke(current, data);
                    p = numbers(tokens, i, 2, data);
                    current.add(PathSegment.lineTo(p[0], p[1]));
                    i += 2;
                    break;
                case 'Q':
                    requireStroke(current, data);
                    p = numbers(tokens, i, 4, data);
                    current.add(PathSegment.quadTo(p[0], p[1], p[2], p[3]));
                    i += 4;
                    break;
                default:
                    throw new InvalidInputException("Unsupported path command '" + command + "' in: " + data);
            }
        }
        if (strokes.isEmpty()) {
            throw new InvalidInputException("Path data has no strokes: " + data);
        }
        return strokes;
    }

    /** Inverse of {@link #parse}, used by the SVG backend and tests. */
    static String format(List<List<PathSegment>> strokes) {
        StringBuilder sb = new StringBuilder();
        for (List<PathSegment> stroke : strokes) {
            for (PathSegment s : stroke) {
                if (sb.length() > 0) sb.append(' ');
                switch (s.kind()) {
                    case MOVE:
                        sb.append("M ").append(num(s.x())).append(' ').append(num(s.y()));
                        break;
                    case LINE:
                        sb.append("L ").append(num(s.x())).append(' ').append(num(s.y()));
                        break;
                    case QUAD:
                        sb.append("Q ").append(num(s.cx())).append(' ').append(num(s.cy()))
                                .append(' ').append(num(s.x())).append(' ').append(num(s.y()));
                        break;
                }
            }
        }
        return sb.toString();
    }

    static String num(double v) {
        String s = String.format(Locale.ROOT, "%.3f", v);
        // trim trailing zeros
        s = s.indexOf('.') >= 0 ? s.replaceAll("0+$", "").replaceAll("\\.$", "") : s;
        return s.equals("-0") ? "0" : s;
    }

    private static List<String> tokenize(String data) {
        // Separate command letters glued to numbers, e.g. "M0 0L1 1"; exponents stay put
        StringBuilder spaced = new StringBuilder();
        for (char c : data.toCharArray()) {
            if (COMMANDS.indexOf(c) >= 0) {
                spaced.append(' ').append(c).append(' ');
            } else {
                spaced.append(c);
            }
        }
        StringTokenizer tokenizer = new StringTokenizer(spaced.toString(), " ,\t\r\n");
        List<String> tokens = new ArrayList<>();
        while (tokenizer.hasMoreTokens()) {
            tokens.add(tokenizer.nextToken());
        }
        return tokens;
    }

    private static boolean isCommand(String token) {
        return token.length() == 1 && COMMANDS.indexOf(token.charAt(0)) >= 0;
    }

    private static double[] numbers(List<String> tokens, int from, int count, String data) {
        if (from + count > tokens.size()) {
            throw new InvalidInputException("Truncated path data: " + data);
        }
        double[] out = new double[count];
        for (int k = 0; k < count; k++) {
            String token = tokens.get(from + k);
            try {
                out[k] = Double.parseDouble(token);
            } catch (NumberFormatException e) {
                throw new InvalidInputException("Bad coordinate '" + token + "' in: " + data, e);
            }
            if (!Double.isFinite(out[k])) {
                throw new InvalidInputException("Non-finite coordinate in: " + data);
            }
        }
        return out;
    }

    private static void requireStroke(List<PathSegment> current, String data) {
        if (current == null) {
            throw new InvalidInputException("Path must begin with M: " + data);
        }
    }
}
