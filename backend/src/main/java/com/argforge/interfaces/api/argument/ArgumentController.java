package com.argforge.interfaces.api.argument;

import com.argforge.application.generation.ArgumentGenerationService;
import com.argforge.domain.argument.model.ArgumentPair;
import com.argforge.domain.argument.model.GeneratedArgument;
import com.argforge.domain.template.model.TemplateBankStatistics;
import com.argforge.domain.template.model.TemplateType;
import com.argforge.infrastructure.rule.RuleRegistry;
import com.argforge.infrastructure.template.TemplateBank;
import com.argforge.interfaces.api.dto.ArgumentPairResponse;
import com.argforge.interfaces.api.dto.ArgumentResponse;
import com.argforge.interfaces.api.dto.GenerateArgumentRequest;
import com.argforge.interfaces.api.dto.RuleResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class ArgumentController {

    private final ArgumentGenerationService generationService;
    private final RuleRegistry ruleRegistry;
    private final TemplateBank templateBank;

    @PostMapping("/arguments")
    public ResponseEntity<ArgumentResponse> generate(@Valid @RequestBody GenerateArgumentRequest request) {
        TemplateType type = request.templateType() == null
                ? TemplateType.VALID
                : TemplateType.fromKey(request.templateType());

        GeneratedArgument argument = generationService.generate(
                request.ruleName(),
                request.sentences(),
                type,
                request.complexity(),
                request.variationPreferences(),
                request.seed());

        return ResponseEntity.ok(ArgumentResponse.from(argument));
    }

    @PostMapping("/arguments/pair")
    public ResponseEntity<ArgumentPairResponse> generatePair(@Valid @RequestBody GenerateArgumentRequest request) {
        ArgumentPair pair = generationService.generatePair(
                request.ruleName(),
                request.sentences(),
                request.complexity(),
                request.variationPreferences(),
                request.seed());

        return ResponseEntity.ok(ArgumentPairResponse.from(pair));
    }

    @GetMapping("/rules")
    public ResponseEntity<List<RuleResponse>> rules() {
        List<RuleResponse> rules = ruleRegistry.allRules().stream()
                .map(rule -> RuleResponse.from(rule, templateBank.ruleNames().contains(rule.validName())))
                .toList();
        return ResponseEntity.ok(rules);
    }

    @GetMapping("/templates/statistics")
    public ResponseEntity<TemplateBankStatistics> statistics() {
        return ResponseEntity.ok(templateBank.getStatistics());
    }
}
