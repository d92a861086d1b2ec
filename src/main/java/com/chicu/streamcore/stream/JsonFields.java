package com.chicu.streamcore.stream;

import org.json.JSONObject;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Общая выборка полей из JSON провайдеров.
 */
public final class JsonFields {

    private JsonFields() {
    }

    /**
     * Все поля объекта, кроме служебных. Числа → BigDecimal, null пропускается.
     *
     * @param aliases имя на проводе → каноническое имя
     */
    public static Map<String, Object> extract(JSONObject data, Set<String> skip, Map<String, String> aliases) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (String name : data.keySet()) {
            if (skip.contains(name)) {
                continue;
            }
            Object value = data.get(name);
            if (value == null || JSONObject.NULL.equals(value)) {
                continue;
            }
            Object normalized = normalize(value);
            if (normalized != null) {
                out.put(aliases.getOrDefault(name, name), normalized);
            }
        }
        return out;
    }

    public static Object normalize(Object value) {
        if (value instanceof BigDecimal bd) {
            return bd;
        }
        if (value instanceof Number n) {
            return new BigDecimal(n.toString());
        }
        if (value instanceof String || value instanceof Boolean) {
            return value;
        }
        // вложенные объекты/массивы в каноническую модель не берём
        return null;
    }
}
