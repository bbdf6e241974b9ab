package pl.marcinmilkowski.drama_network.viz;

import pl.marcinmilkowski.drama_network.graph.InteractionGraph;
import pl.marcinmilkowski.drama_network.graph.InteractionGraph.Edge;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;

/**
 * Force-directed (Fruchterman-Reingold) layout of a character interaction graph,
 * rendered as SVG. Edge width grows with the co-occurrence count, node size with degree.
 *
 * Starting positions come from a fixed seed, so the same graph always gets the same plot.
 */
public class NetworkLayout {

    private static final double MARGIN = 50;
    private static final double MIN_DISTANCE = 0.01;
    private static final double MAX_STEP = 100;

    private static final String STYLE =
        "      .edge { stroke: #999; stroke-opacity: 0.6; fill: none; }\n"
        + "      .node { fill: #4A90E2; stroke: white; stroke-width: 1.5; }\n"
        + "      .label { font-family: sans-serif; font-size: 10px; fill: #333; }\n";

    private final List<String> characters;
    private final Map<String, Integer> indexOf = new HashMap<>();
    private final int[] degree;
    private final double[] x;
    private final double[] y;
    private final List<Edge> edges;
    private final int width;
    private final int height;

    public NetworkLayout(InteractionGraph graph, int width, int height) {
        this.width = width;
        this.height = height;
        this.edges = graph.edges();
        this.characters = new ArrayList<>(graph.nodes());

        int n = characters.size();
        degree = new int[n];
        x = new double[n];
        y = new double[n];
        Random random = new Random(42);
        for (int i = 0; i < n; i++) {
            String character = characters.get(i);
            indexOf.put(character, i);
            degree[i] = graph.degree(character);
            x[i] = MARGIN + random.nextDouble() * Math.max(0, width - 2 * MARGIN);
            y[i] = MARGIN + random.nextDouble() * Math.max(0, height - 2 * MARGIN);
        }
    }

    /**
     * Run the given number of cooling steps.
     */
    public void compute(int iterations) {
        int n = characters.size();
        if (n == 0) return;
        double k = Math.sqrt((double) width * height / n);

        for (int step = 0; step < iterations; step++) {
            double[] dispX = new double[n];
            double[] dispY = new double[n];
            repel(k, dispX, dispY);
            attract(k, dispX, dispY);
            displace(dispX, dispY, MAX_STEP * (1.0 - step / (double) iterations));
        }
    }

    /**
     * Every pair of characters pushes apart with force k^2 / d.
     */
    private void repel(double k, double[] dispX, double[] dispY) {
        for (int i = 0; i < x.length; i++) {
            for (int j = i + 1; j < x.length; j++) {
                double dx = x[i] - x[j];
                double dy = y[i] - y[j];
                double d = Math.max(MIN_DISTANCE, Math.hypot(dx, dy));
                double f = k * k / d;
                dispX[i] += dx / d * f;
                dispY[i] += dy / d * f;
                dispX[j] -= dx / d * f;
                dispY[j] -= dy / d * f;
            }
        }
    }

    /**
     * Linked characters pull together with force d^2 / k, stronger for frequent co-occurrence.
     */
    private void attract(double k, double[] dispX, double[] dispY) {
        for (Edge e : edges) {
            int s = indexOf.get(e.source());
            int t = indexOf.get(e.target());
            double dx = x[t] - x[s];
            double dy = y[t] - y[s];
            double d = Math.max(MIN_DISTANCE, Math.hypot(dx, dy));
            double f = d * d / k * Math.log1p(e.weight());
            dispX[s] += dx / d * f;
            dispY[s] += dy / d * f;
            dispX[t] -= dx / d * f;
            dispY[t] -= dy / d * f;
        }
    }

    /**
     * Move each character by its displacement, capped at the current temperature and kept
     * inside the margins.
     */
    private void displace(double[] dispX, double[] dispY, double temperature) {
        for (int i = 0; i < x.length; i++) {
            double length = Math.hypot(dispX[i], dispY[i]);
            double scale = length > temperature ? temperature / length : 1.0;
            x[i] = clamp(x[i] + dispX[i] * scale, MARGIN, width - MARGIN);
            y[i] = clamp(y[i] + dispY[i] * scale, MARGIN, height - MARGIN);
        }
    }

    private static double clamp(double v, double min, double max) {
        return Math.max(min, Math.min(max, v));
    }

    public double[] position(String character) {
        Integer i = indexOf.get(character);
        return i != null ? new double[] {x[i], y[i]} : null;
    }

    public String toSVG() {
        StringBuilder svg = new StringBuilder();
        svg.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
        line(svg, "<svg xmlns=\"http://www.w3.org/2000/svg\" width=\"%d\" height=\"%d\" viewBox=\"0 0 %d %d\">",
            width, height, width, height);
        svg.append("  <defs>\n    <style>\n").append(STYLE).append("    </style>\n  </defs>\n");
        line(svg, "  <rect width=\"%d\" height=\"%d\" fill=\"#fafafa\"/>", width, height);

        svg.append("  <g id=\"edges\">\n");
        for (Edge e : edges) {
            int s = indexOf.get(e.source());
            int t = indexOf.get(e.target());
            line(svg, "    <line class=\"edge\" x1=\"%.2f\" y1=\"%.2f\" x2=\"%.2f\" y2=\"%.2f\" stroke-width=\"%.2f\"/>",
                x[s], y[s], x[t], y[t], Math.sqrt(e.weight()));
        }
        svg.append("  </g>\n");

        svg.append("  <g id=\"nodes\">\n");
        for (int i = 0; i < characters.size(); i++) {
            line(svg, "    <circle class=\"node\" cx=\"%.2f\" cy=\"%.2f\" r=\"%.2f\"/>", x[i], y[i], radius(i));
        }
        svg.append("  </g>\n");

        svg.append("  <g id=\"labels\">\n");
        for (int i = 0; i < characters.size(); i++) {
            line(svg, "    <text class=\"label\" x=\"%.2f\" y=\"%.2f\" text-anchor=\"middle\">%s</text>",
                x[i], y[i] - radius(i) - 4, escape(characters.get(i)));
        }
        svg.append("  </g>\n");

        return svg.append("</svg>").toString();
    }

    private static void line(StringBuilder svg, String format, Object... args) {
        svg.append(String.format(Locale.ROOT, format, args)).append('\n');
    }

    private double radius(int i) {
        return 4 + 2 * Math.sqrt(degree[i]);
    }

    private static String escape(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            switch (c) {
                case '&': sb.append("&amp;"); break;
                case '<': sb.append("&lt;"); break;
                case '>': sb.append("&gt;"); break;
                case '"': sb.append("&quot;"); break;
                case '\'': sb.append("&apos;"); break;
                default: sb.append(c);
            }
        }
        return sb.toString();
    }
}
