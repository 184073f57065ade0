package com.example.sclanalyzer.service.extraction;

import com.example.sclanalyzer.model.TagReference;
import com.example.sclanalyzer.model.TagSnapshot;
import com.example.sclanalyzer.model.TagSnapshotIndex;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Находит в коде ссылки на теги и сопоставляет их со снимком.
 * <p>
 * Два прохода: сначала имена в кавычках {@code "Name"}, затем голые идентификаторы
 * (ключевые слова SCL отфильтровываются). Повторы устраняются по имени тега в снимке
 * без учёта регистра, поэтому варианты регистра одного тега дают одну запись.
 */
@Slf4j
@Component
public class TagExtractor {

    private static final Pattern QUOTED_NAME = Pattern.compile("\"([^\"]+)\"");

    // цифры после '#' (16#FF, T#5S) не являются идентификаторами
    private static final Pattern BARE_NAME = Pattern.compile("(?<![#\\w])[A-Za-z_]\\w*\\b");

    /**
     * @param cleanCode код после {@link SclSourceCleaner#clean(String)}
     * @param snapshot  снимок тегов
     */
    public TagExtraction extract(String cleanCode, TagSnapshotIndex snapshot) {
        TagExtraction.TagExtractionBuilder result = TagExtraction.builder();
        Set<String> resolvedTags = new HashSet<>();
        Set<String> unresolved = new HashSet<>();

        Matcher quoted = QUOTED_NAME.matcher(cleanCode);
        while (quoted.find()) {
            register(quoted.group(1), snapshot, result, resolvedTags, unresolved);
        }

        Matcher bare = BARE_NAME.matcher(blankQuotedNames(cleanCode));
        while (bare.find()) {
            register(bare.group(), snapshot, result, resolvedTags, unresolved);
        }

        TagExtraction extraction = result.build();
        log.debug("Extracted {} tags, {} unresolved identifiers",
                extraction.getTags().size(), extraction.getUnresolvedIdentifiers().size());
        return extraction;
    }

    /**
     * Заменяет имена в кавычках пробелами той же длины, чтобы второй проход не видел их частей.
     */
    private String blankQuotedNames(String cleanCode) {
        StringBuilder blanked = new StringBuilder(cleanCode);
        Matcher quoted = QUOTED_NAME.matcher(cleanCode);
        while (quoted.find()) {
            for (int i = quoted.start(); i < quoted.end(); i++) {
                blanked.setCharAt(i, ' ');
            }
        }
        return blanked.toString();
    }

    private void register(String candidate,
                          TagSnapshotIndex snapshot,
                          TagExtraction.TagExtractionBuilder result,
                          Set<String> resolvedTags,
                          Set<String> unresolved) {
        if (SclKeywords.isKeyword(candidate)) {
            return;
        }
        Optional<TagSnapshot> tag = snapshot.find(candidate);
        if (tag.isPresent()) {
            if (resolvedTags.add(tag.get().getName().toLowerCase(Locale.ROOT))) {
                result.tag(TagReference.of(tag.get()));
            }
        } else if (unresolved.add(candidate.toLowerCase(Locale.ROOT))) {
            log.debug("Identifier not found in snapshot: {}", candidate);
            result.unresolvedIdentifier(candidate);
        }
    }
}
