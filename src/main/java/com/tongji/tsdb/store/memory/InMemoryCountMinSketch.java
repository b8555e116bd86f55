package com.tongji.tsdb.store.memory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tongji.tsdb.frequency.schema.CountMinScript;
import com.tongji.tsdb.frequency.schema.SketchParameters;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 频次草图脚本的进程内实现，逐条对应 {@link CountMinScript#LUA} 的行为。
 * 调用方（{@link InMemoryPartition}）已持有键空间锁，单次调用即原子。
 */
final class InMemoryCountMinSketch {

    /** 索引从低到高：分数升序，同分按成员字典序（与 ZRANGE 一致）。 */
    private static final Comparator<Map.Entry<String, Double>> ASCENDING =
            Map.Entry.<String, Double>comparingByValue().thenComparing(Map.Entry.comparingByKey());

    private final InMemoryPartition partition;
    private final ObjectMapper objectMapper;

    InMemoryCountMinSketch(InMemoryPartition partition, ObjectMapper objectMapper) {
        this.partition = partition;
        this.objectMapper = objectMapper;
    }

    Object execute(List<String> keys, List<String> arguments) {
        if (keys.size() % 2 != 0) {
            throw new IllegalArgumentException("Frequency table keys must come in (index, sketch) pairs");
        }
        String command = arguments.get(0);
        SketchParameters shape = new SketchParameters(Integer.parseInt(arguments.get(1)), Integer.parseInt(arguments.get(2)),
                Integer.parseInt(arguments.get(3)));
        List<String[]> sketches = new ArrayList<>();
        for (int i = 0; i < keys.size(); i += 2) {
            sketches.add(new String[]{keys.get(i), keys.get(i + 1)});
        }
        List<String> params = arguments.subList(4, arguments.size());
        return switch (command) {
            case CountMinScript.INCR -> increment(sketches, shape, params);
            case CountMinScript.RANKED -> ranked(sketches, shape, params.isEmpty() ? null : Integer.valueOf(params.get(0)));
            case CountMinScript.ESTIMATE -> estimate(sketches, shape, params);
            case CountMinScript.EXPORT -> export(sketches);
            case CountMinScript.IMPORT -> importPayloads(sketches, shape, params);
            default -> throw new IllegalArgumentException("unknown command " + command);
        };
    }

    private List<Object> increment(List<String[]> sketches, SketchParameters shape, List<String> params) {
        for (String[] sketch : sketches) {
            for (int i = 0; i + 1 < params.size(); i += 2) {
                increment(sketch, shape, params.get(i + 1), Long.parseLong(params.get(i)));
            }
        }
        return List.of();
    }

    private void increment(String[] sketch, SketchParameters shape, String member, long weight) {
        Map<String, Long> cells = partition.hash(sketch[1], true);
        long low = Long.MAX_VALUE;
        for (String cell : CountMinScript.cells(member, shape.depth(), shape.width())) {
            low = Math.min(low, cells.merge(cell, weight, Long::sum));
        }
        Map<String, Double> index = partition.zset(sketch[0], true);
        if (index.containsKey(member)) {
            index.merge(member, (double) weight, Double::sum);
        } else if (index.size() < shape.capacity()) {
            index.put(member, (double) weight);
        } else {
            Map.Entry<String, Double> tail = index.entrySet().stream().min(ASCENDING).orElseThrow();
            if (tail.getValue() < low) {
                index.remove(tail.getKey());
                index.put(member, (double) low);
            }
        }
    }

    private List<Object> ranked(List<String[]> sketches, SketchParameters shape, Integer limit) {
        Map<String, Double> totals = new LinkedHashMap<>();
        for (String[] sketch : sketches) {
            Map<String, Double> index = partition.zset(sketch[0], false);
            if (index != null) {
                index.keySet().forEach(member -> totals.putIfAbsent(member, 0.0d));
            }
        }
        totals.replaceAll((member, ignored) -> {
            double total = 0.0d;
            for (String[] sketch : sketches) {
                total += estimate(sketch, shape, member);
            }
            return total;
        });
        List<Map.Entry<String, Double>> ordered = new ArrayList<>(totals.entrySet());
        ordered.sort(Map.Entry.<String, Double>comparingByValue().reversed()
                .thenComparing(Map.Entry.comparingByKey()));
        List<Object> result = new ArrayList<>();
        for (Map.Entry<String, Double> entry : ordered) {
            if (limit != null && result.size() >= limit) {
                break;
            }
            result.add(List.of(entry.getKey(), format(entry.getValue())));
        }
        return result;
    }

    private List<Object> estimate(List<String[]> sketches, SketchParameters shape, List<String> members) {
        List<Object> result = new ArrayList<>();
        for (String[] sketch : sketches) {
            List<String> scores = new ArrayList<>(members.size());
            for (String member : members) {
                scores.add(format(estimate(sketch, shape, member)));
            }
            result.add(scores);
        }
        return result;
    }

    private List<Object> export(List<String[]> sketches) {
        List<Object> result = new ArrayList<>();
        for (String[] sketch : sketches) {
            List<String> index = new ArrayList<>();
            Map<String, Double> zset = partition.zset(sketch[0], false);
            if (zset != null) {
                zset.entrySet().stream().sorted(ASCENDING).forEach(e -> {
                    index.add(e.getKey());
                    index.add(format(e.getValue()));
                });
            }
            List<String> estimators = new ArrayList<>();
            Map<String, Long> cells = partition.hash(sketch[1], false);
            if (cells != null) {
                cells.forEach((cell, count) -> {
                    estimators.add(cell);
                    estimators.add(String.valueOf(count));
                });
            }
            Map<String, List<String>> payload = new LinkedHashMap<>();
            payload.put("i", index);
            payload.put("e", estimators);
            try {
                result.add(objectMapper.writeValueAsString(payload));
            } catch (JsonProcessingException ex) {
                throw new IllegalStateException("Failed to serialize frequency table " + sketch[0], ex);
            }
            partition.delete(sketch[0]);
            partition.delete(sketch[1]);
        }
        return result;
    }

    private List<Object> importPayloads(List<String[]> sketches, SketchParameters shape, List<String> payloads) {
        for (int n = 0; n < sketches.size(); n++) {
            String[] sketch = sketches.get(n);
            JsonNode payload;
            try {
                payload = objectMapper.readTree(payloads.get(n));
            } catch (JsonProcessingException ex) {
                throw new IllegalArgumentException("Malformed frequency table payload", ex);
            }
            JsonNode estimators = payload.path("e");
            if (estimators.size() > 0) {
                Map<String, Long> cells = partition.hash(sketch[1], true);
                for (int j = 0; j + 1 < estimators.size(); j += 2) {
                    cells.merge(estimators.get(j).asText(), Long.parseLong(estimators.get(j + 1).asText()), Long::sum);
                }
            }
            JsonNode entries = payload.path("i");
            Map<String, Double> index = partition.zset(sketch[0], true);
            boolean full = index.size() >= shape.capacity();
            for (int j = 0; j + 1 < entries.size(); j += 2) {
                String member = entries.get(j).asText();
                double score = Double.parseDouble(entries.get(j + 1).asText());
                if (index.containsKey(member)) {
                    index.merge(member, score, Double::sum);
                } else if (!full) {
                    index.put(member, score);
                } else {
                    index.put(member, (double) sketchEstimate(sketch, shape, member));
                }
            }
            trim(index, shape.capacity());
            partition.dropIfEmpty(sketch[0]);
        }
        return List.of();
    }

    private double estimate(String[] sketch, SketchParameters shape, String member) {
        Map<String, Double> index = partition.zset(sketch[0], false);
        if (index != null && index.containsKey(member)) {
            return index.get(member);
        }
        return sketchEstimate(sketch, shape, member);
    }

    private long sketchEstimate(String[] sketch, SketchParameters shape, String member) {
        Map<String, Long> cells = partition.hash(sketch[1], false);
        if (cells == null) {
            return 0L;
        }
        long low = Long.MAX_VALUE;
        for (String cell : CountMinScript.cells(member, shape.depth(), shape.width())) {
            low = Math.min(low, cells.getOrDefault(cell, 0L));
        }
        return low;
    }

    private static void trim(Map<String, Double> index, int capacity) {
        int excess = index.size() - capacity;
        if (excess <= 0) {
            return;
        }
        List<String> lowest = index.entrySet().stream().sorted(ASCENDING).limit(excess).map(Map.Entry::getKey).toList();
        lowest.forEach(index::remove);
    }

    /** 整数分数输出为整数文本，与 Lua tostring 一致。 */
    private static String format(double score) {
        if (score == Math.rint(score) && !Double.isInfinite(score) && Math.abs(score) < 1e15) {
            return String.valueOf((long) score);
        }
        return String.valueOf(score);
    }
}
