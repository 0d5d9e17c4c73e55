package com.example.vectorpdf.application.render;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decodes SVG-style path data into PDF path construction operators.
 * <p>
 * Supported commands are {@code M}, {@code L}, {@code C} and {@code Z}. Upper-case commands take absolute
 * coordinates; lower-case commands are relative to the current point, as in SVG. Text before the first
 * command letter and runs without enough numbers produce no output.
 */
@Component
public class PathDataDecoder {

    private static final Logger log = LoggerFactory.getLogger(PathDataDecoder.class);
    private static final Pattern COMMAND_PATTERN = Pattern.compile("[MLCZmlcz][^MLCZmlcz]*");
    private static final Pattern NUMBER_PATTERN = Pattern.compile("[-+]?[0-9]*\\.?[0-9]+");

    /**
     * @param pathData non-empty path data such as {@code M10,10 L50,50 Z}
     * @return operator text, one instruction per line, each line terminated by {@code \n}
     */
    public String decode(String pathData) {
        StringBuilder ops = new StringBuilder();
        PenState pen = new PenState();
        Matcher commands = COMMAND_PATTERN.matcher(pathData);
        while (commands.find()) {
            String run = commands.group();
            char command = run.charAt(0);
            List<Double> numbers = scanNumbers(run.substring(1));
            String op = switch (command) {
                case 'M', 'm' -> moveTo(pen, numbers, command == 'm');
                case 'L', 'l' -> lineTo(pen, numbers, command == 'l');
                case 'C', 'c' -> curveTo(pen, numbers, command == 'c');
                default -> closePath(pen);
            };
            if (op == null) {
                log.debug("Skipping path command '{}' with {} operand(s)", command, numbers.size());
                continue;
            }
            ops.append(op);
        }
        return ops.toString();
    }

    private String moveTo(PenState pen, List<Double> numbers, boolean relative) {
        if (numbers.size() < 2) {
            return null;
        }
        double x = relative ? pen.x + numbers.get(0) : numbers.get(0);
        double y = relative ? pen.y + numbers.get(1) : numbers.get(1);
        pen.moveTo(x, y);
        return PdfNumbers.join(x, y) + " m\n";
    }

    private String lineTo(PenState pen, List<Double> numbers, boolean relative) {
        if (numbers.size() < 2) {
            return null;
        }
        double x = relative ? pen.x + numbers.get(0) : numbers.get(0);
        double y = relative ? pen.y + numbers.get(1) : numbers.get(1);
        pen.lineTo(x, y);
        return PdfNumbers.join(x, y) + " l\n";
    }

    private String curveTo(PenState pen, List<Double> numbers, boolean relative) {
        if (numbers.size() < 6) {
            return null;
        }
        double dx = relative ? pen.x : 0;
        double dy = relative ? pen.y : 0;
        double[] points = new double[6];
        for (int i = 0; i < 6; i += 2) {
            points[i] = numbers.get(i) + dx;
            points[i + 1] = numbers.get(i + 1) + dy;
        }
        pen.lineTo(points[4], points[5]);
        return PdfNumbers.join(points) + " c\n";
    }

    private String closePath(PenState pen) {
        pen.close();
        return "h\n";
    }

    private static List<Double> scanNumbers(String params) {
        List<Double> numbers = new ArrayList<>();
        Matcher matcher = NUMBER_PATTERN.matcher(params);
        while (matcher.find()) {
            numbers.add(Double.parseDouble(matcher.group()));
        }
        return numbers;
    }

    /**
     * Current point and subpath start, needed to resolve relative commands.
     */
    private static final class PenState {
        private double x;
        private double y;
        private double startX;
        private double startY;

        void moveTo(double newX, double newY) {
            x = newX;
            y = newY;
            startX = newX;
            startY = newY;
        }

        void lineTo(double newX, double newY) {
            x = newX;
            y = newY;
        }

        void close() {
            x = startX;
            y = startY;
        }
    }
}
