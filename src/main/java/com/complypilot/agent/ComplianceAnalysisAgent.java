package com.complypilot.agent;

import com.complypilot.exception.AnalyzerException;
import com.complypilot.model.ComplianceAnalysis;
import com.complypilot.model.ComplianceAnalysis.FrameworkCompliance;
import com.complypilot.model.ComplianceAnalysis.PriorityAction;
import com.complypilot.service.StructuredLlmCaller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Set;

/**
 * UK compliance analysis agent.
 * Reviews a policy document against:
 * - GDPR (UK GDPR / Data Protection Act 2018)
 * - Cyber Essentials controls
 * and returns strengths, gaps, recommendations and prioritized actions.
 */
@Service
public class ComplianceAnalysisAgent implements ComplianceAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ComplianceAnalysisAgent.class);

    static final String AGENT_NAME = "ComplianceAnalysisAgent";

    private static final Set<String> GDPR_STATUSES = Set.of("compliant", "partial", "non-compliant");
    private static final Set<String> CYBER_STATUSES =
            Set.of("compliant", "partial", "non-compliant", "not-applicable");

    private static final String SYSTEM_PROMPT = """
            You are a UK compliance expert specializing in GDPR and Cyber Essentials certification.
            Always respond with valid JSON only.
            """;

    private static final String USER_PROMPT = """
            Analyze the following policy document and provide a detailed compliance gap analysis.

            Document content:
            ---
            %s
            ---

            FIELDS:
            - document_type: what type of policy this appears to be
            - overall_assessment: brief overall assessment
            - gdpr_compliance: score from 0-100, status compliant|partial|non-compliant,
              GDPR strengths found, specific GDPR gaps or missing elements,
              actionable recommendations to address the gaps
            - cyber_essentials_compliance: score from 0-100,
              status compliant|partial|non-compliant|not-applicable,
              strengths, specific gaps against Cyber Essentials controls, actionable recommendations
            - priority_actions: each with priority high|medium|low, the specific action to take,
              framework GDPR|Cyber Essentials|Both, and the rationale
            - risk_summary: brief paragraph summarizing the compliance risk exposure

            Be specific and practical in your recommendations, tailored for UK SMEs with 5-50 employees.
            """;

    private final ChatClient chatClient;

    public ComplianceAnalysisAgent(@Qualifier("analysisChatClient") ChatClient chatClient) {
        this.chatClient = chatClient;
    }

    @Override
    public ComplianceAnalysis analyze(String documentExcerpt) {
        log.info("{}: starting analysis ({} characters)", AGENT_NAME, documentExcerpt.length());

        ComplianceAnalysis analysis = StructuredLlmCaller.callEntity(
                chatClient, SYSTEM_PROMPT, USER_PROMPT.formatted(documentExcerpt),
                ComplianceAnalysis.class, AGENT_NAME);
        validate(analysis);

        log.info("{}: analysis completed, '{}' (GDPR {}, CE {}), {} priority actions", AGENT_NAME,
                analysis.documentType(), analysis.gdprCompliance().score(),
                analysis.cyberEssentialsCompliance().score(), analysis.priorityActions().size());
        return analysis;
    }

    /**
     * Rejects replies that parsed as JSON but miss required fields or carry out-of-range values.
     */
    static void validate(ComplianceAnalysis analysis) {
        requireText("document_type", analysis.documentType());
        requireText("overall_assessment", analysis.overallAssessment());
        requireText("risk_summary", analysis.riskSummary());
        checkFramework("gdpr_compliance", analysis.gdprCompliance(), GDPR_STATUSES);
        checkFramework("cyber_essentials_compliance", analysis.cyberEssentialsCompliance(), CYBER_STATUSES);
        for (PriorityAction action : analysis.priorityActions()) {
            if (action == null || action.priority() == null || action.action() == null || action.action().isBlank()) {
                throw new AnalyzerException("Analysis reply has a priority action without priority or action");
            }
        }
    }

    private static void requireText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new AnalyzerException("Analysis reply is missing " + field);
        }
    }

    private static void checkFramework(String field, FrameworkCompliance framework, Set<String> statuses) {
        if (framework == null) {
            throw new AnalyzerException("Analysis reply is missing " + field);
        }
        if (framework.score() < 0 || framework.score() > 100) {
            throw new AnalyzerException(field + ".score out of range: " + framework.score());
        }
        if (framework.status() == null || !statuses.contains(framework.status().toLowerCase(Locale.ROOT))) {
            throw new AnalyzerException(field + ".status not recognised: " + framework.status());
        }
    }
}
