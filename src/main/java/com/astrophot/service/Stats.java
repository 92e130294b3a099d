package com.astrophot.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

// Estadística básica; los NaN cuentan como ausentes
final class Stats {

    private Stats() {}

    static double mean(double[] values) {
        double sum = 0;
        int n = 0;
        for (double v : values) {
            if (Double.isNaN(v)) continue;
            sum += v;
            n++;
        }
        return n == 0 ? Double.NaN : sum / n;
    }

    /** Desviación estándar poblacional; 0 con menos de dos valores. */
    static double std(double[] values) {
        double mean = mean(values);
        if (Double.isNaN(mean)) return Double.NaN;
        double sum = 0;
        int n = 0;
        for (double v : values) {
            if (Double.isNaN(v)) continue;
            sum += (v - mean) * (v - mean);
            n++;
        }
        return n < 2 ? 0.0 : Math.sqrt(sum / n);
    }

    static double median(List<Double> values) {
        List<Double> sorted = new ArrayList<>();
        for (Double v : values) if (v != null && !Double.isNaN(v)) sorted.add(v);
        if (sorted.isEmpty()) return Double.NaN;
        Collections.sort(sorted);
        int n = sorted.size();
        return n % 2 == 1 ? sorted.get(n / 2) : (sorted.get(n / 2 - 1) + sorted.get(n / 2)) / 2.0;
    }

    static double median(double[] values) {
        List<Double> list = new ArrayList<>(values.length);
        for (double v : values) list.add(v);
        return median(list);
    }

    static double mad(List<Double> values, double median) {
        List<Double> dev = new ArrayList<>(values.size());
        for (Double v : values) if (v != null && !Double.isNaN(v)) dev.add(Math.abs(v - median));
        return median(dev);
    }
}
