package com.medicalcor.crm.triage.service;

import com.medicalcor.crm.triage.model.TriageInput;
import com.medicalcor.crm.triage.model.TriageResult;

/**
 * Urgency and intent classification of an inbound contact. Called synchronously; implementations backed by a
 * remote service are expected to enforce their own timeouts.
 */
public interface TriageAssessor {

    TriageResult assess(TriageInput input);

    boolean isVip(String phone);
}
