package edu.mcw.rgd.dataload.patientvariants;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * @since 10/6/26
 * named counters; one instance per batch, plus one for the whole run
 */
public class Counters {

    private final Map<String, Integer> counters = new ConcurrentHashMap<>();

    public void increment(String counterName) {
        add(counterName, 1);
    }

    public void add(String counterName, int inc) {
        counters.merge(counterName, inc, Integer::sum);
    }

    public int get(String counterName) {
        return counters.getOrDefault(counterName, 0);
    }

    public void addAll(Counters other) {
        for( Map.Entry<String, Integer> entry: other.counters.entrySet() ) {
            add(entry.getKey(), entry.getValue());
        }
    }

    public String dumpAlphabetically() {
        StringBuilder buf = new StringBuilder();
        for( Map.Entry<String, Integer> entry: new TreeMap<>(counters).entrySet() ) {
            buf.append(entry.getKey()).append(": ").append(entry.getValue()).append("\n");
        }
        return buf.toString();
    }
}
