package com.compass.evidencecollector.service.job;

import com.compass.evidencecollector.model.evaluation.JobTemplateSnapshot;

/**
 * Read-only access to job templates.
 */
public interface JobTemplateStore {

    /**
     * Returns a snapshot of the active template with the given id.
     *
     * @throws com.compass.evidencecollector.exception.JobTemplateNotFoundException if there is no such active template
     * @throws com.compass.evidencecollector.exception.InvalidJobTemplateException  if the template cannot drive a collection
     */
    JobTemplateSnapshot getTemplate(String templateId);
}
