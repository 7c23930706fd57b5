package com.shuking.ojjudge.service.adapter;

import com.shuking.ojjudge.model.enums.LanguageEnum;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 按语言标识或别名查找适配器
 */
@Component
public class LanguageAdapterRegistry {

    private final Map<LanguageEnum, LanguageAdapter> adapters = new EnumMap<>(LanguageEnum.class);

    public LanguageAdapterRegistry(List<LanguageAdapter> adapterList) {
        for (LanguageAdapter adapter : adapterList) {
            LanguageAdapter previous = adapters.put(adapter.language(), adapter);
            if (previous != null) {
                throw new IllegalStateException("duplicate adapter for language " + adapter.language().getValue());
            }
        }
    }

    /**
     * @param language 语言标识或别名，大小写不敏感
     * @return 适配器，不支持时返回 null
     */
    public LanguageAdapter get(String language) {
        LanguageEnum languageEnum = LanguageEnum.getEnumByValue(language);
        return languageEnum == null ? null : adapters.get(languageEnum);
    }

    /**
     * 已注册的语言标识
     */
    public List<String> supportedLanguages() {
        List<String> languages = new ArrayList<>();
        adapters.keySet().forEach(languageEnum -> languages.add(languageEnum.getValue()));
        return Collections.unmodifiableList(languages);
    }
}
