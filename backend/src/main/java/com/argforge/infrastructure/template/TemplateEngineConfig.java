package com.argforge.infrastructure.template;

import com.argforge.domain.language.LanguagePatternProvider;
import com.argforge.infrastructure.language.EnglishPatternProvider;
import com.argforge.infrastructure.variation.VariationLibrary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class TemplateEngineConfig {

    @Value("${generator.pattern-source:english}")
    private String patternSource;

    @Bean
    public TemplateBank templateBank() {
        TemplateBank bank = new TemplateBank();
        new EnglishTemplateCatalog().registerInto(bank);
        return bank;
    }

    @Bean
    public LanguagePatternProvider languagePatternProvider() {
        LanguagePatternProvider provider = switch (patternSource.toLowerCase()) {
            case "english" -> new EnglishPatternProvider();
            case "library" -> new VariationLibrary();
            default -> throw new IllegalStateException("Unknown generator.pattern-source: " + patternSource);
        };
        log.info("[TemplateEngineConfig] Pattern source: {} ({})", patternSource, provider.languageCode());
        return provider;
    }
}
