package com.example.sclanalyzer.service.execution;

import com.example.sclanalyzer.model.BindingOrigin;
import com.example.sclanalyzer.model.LocalBinding;
import com.example.sclanalyzer.model.TagSnapshot;
import com.example.sclanalyzer.model.TagSnapshotIndex;
import com.example.sclanalyzer.service.expression.VariableResolver;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Локальные переменные одного анализа: теги из снимка и результаты присваиваний.
 * <p>
 * Имена в SCL нечувствительны к регистру, поэтому {@code motor := 1} перезаписывает
 * тег {@code Motor}. Экземпляр принадлежит одному вызову анализа и не потокобезопасен.
 */
public class LocalVariableEnvironment implements VariableResolver {

    private final Map<String, LocalBinding> bindings = new LinkedHashMap<>();
    private final Set<String> computedOrder = new LinkedHashSet<>();

    /**
     * Создаёт окружение, заполненное тегами снимка (origin = CACHE).
     */
    public static LocalVariableEnvironment seededFrom(TagSnapshotIndex snapshot) {
        LocalVariableEnvironment environment = new LocalVariableEnvironment();
        for (TagSnapshot tag : snapshot.distinctTags()) {
            environment.bind(LocalBinding.builder()
                    .name(tag.getName())
                    .value(TagValueDecoder.decode(tag.getRawValue(), tag.getDeclaredType()))
                    .declaredType(tag.getDeclaredType())
                    .origin(BindingOrigin.CACHE)
                    .build());
        }
        return environment;
    }

    /**
     * Создаёт или перезаписывает переменную (последняя запись побеждает).
     */
    public void bind(LocalBinding binding) {
        String key = key(binding.getName());
        bindings.put(key, binding);
        if (binding.isComputed()) {
            computedOrder.add(key);
        }
    }

    @Override
    public Optional<LocalBinding> resolve(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(bindings.get(key(name)));
    }

    /**
     * Вычисленные переменные с итоговыми значениями в порядке первого присваивания.
     */
    public List<LocalBinding> computedBindings() {
        List<LocalBinding> computed = new ArrayList<>();
        for (String key : computedOrder) {
            LocalBinding binding = bindings.get(key);
            if (binding != null && binding.isComputed()) {
                computed.add(binding);
            }
        }
        return computed;
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
