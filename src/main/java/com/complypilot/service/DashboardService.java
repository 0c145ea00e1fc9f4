package com.complypilot.service;

import com.complypilot.model.AnalysisStatus;
import com.complypilot.model.Assessment;
import com.complypilot.model.Dashboard;
import com.complypilot.model.Dashboard.PriorityActionItem;
import com.complypilot.model.Dashboard.RiskStats;
import com.complypilot.model.PolicyDocument;
import com.complypilot.model.Risk;
import com.complypilot.model.RiskRegister;
import com.complypilot.model.RiskStatus;
import com.complypilot.model.User;
import com.complypilot.repository.AssessmentRepository;
import com.complypilot.repository.PolicyDocumentRepository;
import com.complypilot.repository.RiskRegisterRepository;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only composition of a subject's latest assessment, register and documents.
 */
@Service
public class DashboardService {

    static final int MAX_GAP_ACTIONS = 5;
    static final int MAX_PENDING_DOCUMENT_ACTIONS = 3;
    static final int RECENT_DOCUMENTS = 5;

    private final AssessmentRepository assessmentRepository;
    private final RiskRegisterRepository registerRepository;
    private final PolicyDocumentRepository documentRepository;

    public DashboardService(AssessmentRepository assessmentRepository,
                            RiskRegisterRepository registerRepository,
                            PolicyDocumentRepository documentRepository) {
        this.assessmentRepository = assessmentRepository;
        this.registerRepository = registerRepository;
        this.documentRepository = documentRepository;
    }

    public Dashboard dashboard(User user) {
        String subjectId = user.userId();
        Optional<Assessment> latest = assessmentRepository.findFirstBySubjectIdOrderByCreatedAtDesc(subjectId);
        Optional<RiskRegister> register = registerRepository.findFirstBySubjectId(subjectId);
        List<PolicyDocument> documents = documentRepository.findTop10BySubjectIdOrderByCreatedAtDesc(subjectId);

        int analyzed = (int) documents.stream()
                .filter(d -> d.analysisStatus() == AnalysisStatus.COMPLETED)
                .count();

        return new Dashboard(
                user,
                latest.map(Assessment::complianceScore).orElse(null),
                latest.map(Assessment::gdprScore).orElse(null),
                latest.map(Assessment::cyberEssentialsScore).orElse(null),
                latest.map(Assessment::riskLevel).orElse(null),
                latest.map(Assessment::createdAt).orElse(null),
                riskStats(register.map(RiskRegister::risks).orElse(List.of())),
                documents.size(),
                analyzed,
                priorityActions(latest, documents),
                documents.stream().limit(RECENT_DOCUMENTS).toList());
    }

    static RiskStats riskStats(List<Risk> risks) {
        Map<RiskStatus, Integer> tally = new EnumMap<>(RiskStatus.class);
        for (Risk risk : risks) {
            RiskStatus status = risk.status() != null ? risk.status() : RiskStatus.IDENTIFIED;
            tally.merge(status, 1, Integer::sum);
        }
        return new RiskStats(
                tally.getOrDefault(RiskStatus.IDENTIFIED, 0),
                tally.getOrDefault(RiskStatus.MITIGATING, 0),
                tally.getOrDefault(RiskStatus.RESOLVED, 0),
                tally.getOrDefault(RiskStatus.ACCEPTED, 0),
                risks.size());
    }

    /**
     * Top gaps of the latest assessment (already in priority order), then documents still awaiting analysis.
     */
    static List<PriorityActionItem> priorityActions(Optional<Assessment> latest, List<PolicyDocument> documents) {
        List<PriorityActionItem> actions = new ArrayList<>();
        latest.ifPresent(assessment -> assessment.gaps().stream()
                .limit(MAX_GAP_ACTIONS)
                .map(PriorityActionItem::forGap)
                .forEach(actions::add));
        documents.stream()
                .filter(d -> d.analysisStatus() == AnalysisStatus.PENDING)
                .limit(MAX_PENDING_DOCUMENT_ACTIONS)
                .map(PriorityActionItem::forPendingDocument)
                .forEach(actions::add);
        return List.copyOf(actions);
    }
}
