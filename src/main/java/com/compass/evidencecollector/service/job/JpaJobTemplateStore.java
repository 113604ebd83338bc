package com.compass.evidencecollector.service.job;

import com.compass.evidencecollector.config.EvidenceCollectionProperties;
import com.compass.evidencecollector.exception.InvalidJobTemplateException;
import com.compass.evidencecollector.exception.JobRecordStoreException;
import com.compass.evidencecollector.exception.JobTemplateNotFoundException;
import com.compass.evidencecollector.model.JobTemplate;
import com.compass.evidencecollector.model.TemplateRule;
import com.compass.evidencecollector.model.evaluation.JobTemplateSnapshot;
import com.compass.evidencecollector.model.evaluation.RuleSelector;
import com.compass.evidencecollector.repository.JobTemplateRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.List;

@Slf4j
@Service
public class JpaJobTemplateStore implements JobTemplateStore {

    static final String SUPPORTED_SCAN_TYPE = "aws_config";

    private final JobTemplateRepository jobTemplateRepository;
    private final String defaultRegion;

    public JpaJobTemplateStore(JobTemplateRepository jobTemplateRepository, EvidenceCollectionProperties properties) {
        this.jobTemplateRepository = jobTemplateRepository;
        this.defaultRegion = properties.getEvaluation().getDefaultRegion();
    }

    @Override
    @Transactional(readOnly = true)
    public JobTemplateSnapshot getTemplate(final String templateId) {
        final JobTemplate template;
        try {
            template = jobTemplateRepository.findByIdAndActiveTrue(templateId)
                                            .orElseThrow(() -> new JobTemplateNotFoundException(templateId));
        } catch (final DataAccessException e) {
            throw new JobRecordStoreException("Failed to load job template " + templateId, e);
        }
        return toSnapshot(template);
    }

    private JobTemplateSnapshot toSnapshot(final JobTemplate template) {
        if (!SUPPORTED_SCAN_TYPE.equals(template.getScanType())) {
            throw new InvalidJobTemplateException(String.format(
                    "Job template %s has unsupported scan type '%s'", template.getId(), template.getScanType()));
        }
        final List<TemplateRule> rules = template.getRules();
        if (rules == null || rules.isEmpty()) {
            throw new InvalidJobTemplateException("Job template " + template.getId() + " defines no rule prefixes");
        }
        // A blank prefix would match every rule in the account.
        if (rules.stream().anyMatch(rule -> !StringUtils.hasText(rule.getPrefix()))) {
            throw new InvalidJobTemplateException("Job template " + template.getId() + " contains a blank rule prefix");
        }

        final String region = StringUtils.hasText(template.getRegion()) ? template.getRegion() : defaultRegion;
        final List<RuleSelector> selectors = rules.stream()
                                                  .map(rule -> new RuleSelector(rule.getPrefix(), rule.getLink()))
                                                  .toList();
        log.debug("Loaded job template {} ({} rule prefixes, region {})", template.getId(), selectors.size(), region);
        return new JobTemplateSnapshot(template.getId(), template.getName(), template.getDocumentationLink(), region,
                                       selectors);
    }
}
