package dev.ppee;

import dev.ppee.checklist.Checklist;
import dev.ppee.checklist.ChecklistParameter;
import dev.ppee.checklist.ChecklistParameterRepository;
import dev.ppee.checklist.ChecklistRepository;
import dev.ppee.checklist.ParameterResult;
import dev.ppee.checklist.ParameterResultRepository;
import dev.ppee.document.DocumentChunk;
import dev.ppee.document.DocumentChunkRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Verifies each JPA entity can be persisted and read back against the Flyway schema,
 * since ddl-auto only validates.
 */
@Transactional
class JpaSchemaDriftIT extends BaseIntegrationTest {

    @Autowired
    private ChecklistRepository checklistRepository;

    @Autowired
    private ChecklistParameterRepository parameterRepository;

    @Autowired
    private ParameterResultRepository resultRepository;

    @Autowired
    private DocumentChunkRepository documentChunkRepository;

    @Test
    void checklistWithParametersRoundtripsInOrder() {
        Checklist checklist = checklistRepository.saveAndFlush(
                new Checklist("Экспертиза ПД", "Параметры раздела 1"));
        ChecklistParameter second = new ChecklistParameter(checklist.getId(), "ИНН", "ИНН заказчика", 2);
        ChecklistParameter first = new ChecklistParameter(
                checklist.getId(), "Форма", "организационно-правовая форма", 1);
        first.setUseReranker(true);
        first.setRerankLimit(30);
        first.setLlmModel("gemma3:27b");
        first.setLlmTemperature(0.2);
        first.setLlmMaxTokens(500);
        parameterRepository.saveAndFlush(second);
        parameterRepository.saveAndFlush(first);

        List<ChecklistParameter> found =
                parameterRepository.findByChecklistIdOrderByOrderIndexAscIdAsc(checklist.getId());

        assertThat(found).extracting(ChecklistParameter::getName).containsExactly("Форма", "ИНН");
        ChecklistParameter loaded = found.get(0);
        assertThat(loaded.isUseReranker()).isTrue();
        assertThat(loaded.getRerankLimit()).isEqualTo(30);
        assertThat(loaded.getLlmTemperature()).isEqualTo(0.2);
        assertThat(loaded.getSearchLimit()).isEqualTo(3);
        assertThat(checklistRepository.findById(checklist.getId()).orElseThrow().getCreatedAt())
                .isNotNull();
    }

    @Test
    void parameterResultStoresJsonColumns() {
        Checklist checklist = checklistRepository.saveAndFlush(new Checklist("ПД", null));
        ChecklistParameter parameter = parameterRepository.saveAndFlush(
                new ChecklistParameter(checklist.getId(), "Форма", "форма", 0));
        ParameterResult result = new ParameterResult("app-1", parameter.getId());
        result.update("АО", 0.9, "[{\"position\":1}]", "{\"model\":\"gemma3:27b\"}");

        ParameterResult saved = resultRepository.saveAndFlush(result);
        ParameterResult found = resultRepository
                .findByApplicationIdAndParameterId("app-1", parameter.getId())
                .orElseThrow();

        assertThat(found.getId()).isEqualTo(saved.getId());
        assertThat(found.getValue()).isEqualTo("АО");
        assertThat(found.getSearchResults()).contains("position");
        assertThat(found.getLlmRequest()).contains("gemma3:27b");
        assertThat(found.getUpdatedAt()).isNotNull();
    }

    @Test
    void secondResultForSameApplicationAndParameterIsRejected() {
        Checklist checklist = checklistRepository.saveAndFlush(new Checklist("ПД", null));
        ChecklistParameter parameter = parameterRepository.saveAndFlush(
                new ChecklistParameter(checklist.getId(), "Форма", "форма", 0));
        resultRepository.saveAndFlush(new ParameterResult("app-1", parameter.getId()));

        assertThatThrownBy(() ->
                resultRepository.saveAndFlush(new ParameterResult("app-1", parameter.getId())))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void documentChunkReadableViaJpaAfterLangchain4jInsert() {
        String storedId = seedChunk("app-1", "doc-1", 0, "Проверка схемы таблицы фрагментов");

        DocumentChunk found = documentChunkRepository.findById(UUID.fromString(storedId)).orElseThrow();

        assertThat(found.getText()).isEqualTo("Проверка схемы таблицы фрагментов");
        assertThat(found.getMetadata()).contains("\"application_id\"").contains("app-1");
        assertThat(found.getCreatedAt()).isNotNull();
    }
}
