package com.example.sclanalyzer.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Снимок тегов PLC, переданный вызывающей стороной перед запуском анализа.
 * <p>
 * Один и тот же тег может быть зарегистрирован под несколькими ключами
 * (имя и его варианты регистра). Экземпляр неизменяем.
 */
public final class TagSnapshotIndex {

    private static final TagSnapshotIndex EMPTY = new TagSnapshotIndex(Map.of());

    private final Map<String, TagSnapshot> byKey;

    private TagSnapshotIndex(Map<String, TagSnapshot> byKey) {
        this.byKey = Collections.unmodifiableMap(new LinkedHashMap<>(byKey));
    }

    public static TagSnapshotIndex empty() {
        return EMPTY;
    }

    /**
     * Строит индекс из списка тегов: каждый тег доступен по имени и по имени в нижнем регистре.
     */
    public static TagSnapshotIndex of(Collection<TagSnapshot> tags) {
        Map<String, TagSnapshot> keys = new LinkedHashMap<>();
        for (TagSnapshot tag : tags) {
            if (tag == null || tag.getName() == null || tag.getName().isBlank()) {
                continue;
            }
            keys.put(tag.getName(), tag);
            keys.putIfAbsent(tag.getName().toLowerCase(Locale.ROOT), tag);
        }
        return new TagSnapshotIndex(keys);
    }

    /**
     * Строит индекс из готового отображения ключ → тег (ключи могут быть вариантами регистра).
     */
    public static TagSnapshotIndex ofKeys(Map<String, TagSnapshot> keys) {
        return new TagSnapshotIndex(keys);
    }

    /**
     * Ищет тег: точное имя, затем нижний регистр, затем верхний регистр.
     */
    public Optional<TagSnapshot> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        TagSnapshot tag = byKey.get(name);
        if (tag == null) {
            tag = byKey.get(name.toLowerCase(Locale.ROOT));
        }
        if (tag == null) {
            tag = byKey.get(name.toUpperCase(Locale.ROOT));
        }
        return Optional.ofNullable(tag);
    }

    /**
     * Каждый тег ровно один раз (по имени тега), в порядке регистрации.
     */
    public List<TagSnapshot> distinctTags() {
        Map<String, TagSnapshot> distinct = new LinkedHashMap<>();
        for (TagSnapshot tag : byKey.values()) {
            distinct.putIfAbsent(tag.getName(), tag);
        }
        return new ArrayList<>(distinct.values());
    }

    public int size() {
        return distinctTags().size();
    }
}
