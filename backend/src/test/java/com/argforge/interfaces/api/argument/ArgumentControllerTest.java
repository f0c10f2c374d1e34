package com.argforge.interfaces.api.argument;

import com.argforge.application.generation.ArgumentGenerationService;
import com.argforge.infrastructure.language.EnglishPatternProvider;
import com.argforge.infrastructure.rule.RuleRegistry;
import com.argforge.infrastructure.template.EnglishTemplateCatalog;
import com.argforge.infrastructure.template.TemplateBank;
import com.argforge.infrastructure.variation.VariationStyleSelector;
import com.argforge.interfaces.api.GlobalExceptionHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.hamcrest.Matchers.endsWith;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ArgumentControllerTest {

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        TemplateBank bank = new TemplateBank();
        new EnglishTemplateCatalog().registerInto(bank);
        RuleRegistry registry = new RuleRegistry();
        ArgumentGenerationService service = new ArgumentGenerationService(
                bank, registry, new EnglishPatternProvider(), new VariationStyleSelector());

        mockMvc = MockMvcBuilders.standaloneSetup(new ArgumentController(service, registry, bank))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void generates_a_valid_argument_by_default() throws Exception {
        mockMvc.perform(post("/api/v1/arguments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"ruleName": "Modus Ponens",
                                 "sentences": ["it rains", "the ground is wet"],
                                 "complexity": "BASIC",
                                 "variationPreferences": {"conclusion": "Thus"},
                                 "seed": 3}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ruleName").value("Modus Ponens"))
                .andExpect(jsonPath("$.templateType").value("valid"))
                .andExpect(jsonPath("$.text", endsWith("Thus, the ground is wet.")));
    }

    @Test
    void null_preference_values_are_ignored() throws Exception {
        mockMvc.perform(post("/api/v1/arguments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"ruleName": "Modus Ponens",
                                 "sentences": ["it rains", "the ground is wet"],
                                 "complexity": "BASIC",
                                 "variationPreferences": {"conclusion": null},
                                 "seed": 3}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.text", endsWith(", the ground is wet.")));
    }

    @Test
    void generates_a_pair() throws Exception {
        mockMvc.perform(post("/api/v1/arguments/pair")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"ruleName": "Modus Tollens", "sentences": ["it rains", "the ground is wet"], "seed": 8}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid.argumentName").value("Modus Tollens"))
                .andExpect(jsonPath("$.invalid.argumentName").value("Denying the Antecedent"))
                .andExpect(jsonPath("$.sentences", hasSize(2)));
    }

    @Test
    void unknown_rule_is_not_found() throws Exception {
        mockMvc.perform(post("/api/v1/arguments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"ruleName": "Modus Bogus", "sentences": ["a", "b"]}
                                """))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("UNKNOWN_RULE"));
    }

    @Test
    void too_few_sentences_is_bad_request() throws Exception {
        mockMvc.perform(post("/api/v1/arguments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"ruleName": "Hypothetical Syllogism", "sentences": ["a"]}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INSUFFICIENT_SENTENCES"));
    }

    @Test
    void invalid_template_type_fails_validation() throws Exception {
        mockMvc.perform(post("/api/v1/arguments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"ruleName": "Modus Ponens", "sentences": ["a", "b"], "templateType": "sound"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    @Test
    void lists_rules_with_template_availability() throws Exception {
        mockMvc.perform(get("/api/v1/rules"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(11)))
                .andExpect(jsonPath("$[0].name").value("Modus Ponens"))
                .andExpect(jsonPath("$[0].hasTemplates").value(true));
    }

    @Test
    void reports_bank_statistics() throws Exception {
        mockMvc.perform(get("/api/v1/templates/statistics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalRules").value(11))
                .andExpect(jsonPath("$.perRule['Modus Ponens'].valid").value(3));
    }
}
