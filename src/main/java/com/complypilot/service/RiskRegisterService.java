package com.complypilot.service;

import com.complypilot.catalog.RiskTemplateLibrary;
import com.complypilot.exception.NotFoundException;
import com.complypilot.model.Risk;
import com.complypilot.model.RiskRegister;
import com.complypilot.model.RiskStatus;
import com.complypilot.model.RiskTemplateEntry;
import com.complypilot.repository.RiskRegisterRepository;
import com.complypilot.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Lifecycle of a subject's risk register.
 * <p>
 * A subject has at most one register. Generating a new one replaces the old one; mutations
 * for the same subject run under {@link SubjectLocks}, so the delete-then-insert replacement
 * never interleaves with another generate or a status update.
 */
@Service
public class RiskRegisterService {

    private static final Logger log = LoggerFactory.getLogger(RiskRegisterService.class);

    private final RiskTemplateLibrary templates;
    private final RiskRegisterRepository registerRepository;
    private final UserRepository userRepository;
    private final SubjectLocks locks;
    private final Clock clock;

    public RiskRegisterService(RiskTemplateLibrary templates,
                               RiskRegisterRepository registerRepository,
                               UserRepository userRepository,
                               SubjectLocks locks,
                               Clock clock) {
        this.templates = templates;
        this.registerRepository = registerRepository;
        this.userRepository = userRepository;
        this.locks = locks;
        this.clock = clock;
    }

    /**
     * Builds a register from the template of the business type and makes it the subject's
     * only register. Unknown business types use the general template.
     *
     * @param businessType free-text business type, stored as given
     * @param industry     optional industry, stored as given
     */
    public RiskRegister generate(String subjectId, String businessType, String industry) {
        List<RiskTemplateEntry> template = templates.templateFor(businessType);
        List<Risk> risks = template.stream().map(Risk::fromTemplate).toList();
        Instant now = Instant.now(clock);
        RiskRegister register = new RiskRegister(UUID.randomUUID().toString(), subjectId,
                businessType, industry, risks, risks.size(), now, now);

        RiskRegister saved = locks.withLock(subjectId, () -> {
            long replaced = registerRepository.deleteBySubjectId(subjectId);
            if (replaced > 0) {
                log.info("Replacing {} existing risk register(s) for {}", replaced, subjectId);
            }
            return registerRepository.save(register);
        });

        userRepository.findById(subjectId)
                .ifPresent(user -> userRepository.save(user.withBusinessProfile(businessType, industry)));

        log.info("Generated risk register {} for {} from template '{}' ({} risks)",
                saved.id(), subjectId, RiskTemplateLibrary.normalize(businessType), risks.size());
        return saved;
    }

    public Optional<RiskRegister> get(String subjectId) {
        return registerRepository.findFirstBySubjectId(subjectId);
    }

    /**
     * Sets the status of one risk. Every status is reachable from every other.
     *
     * @param notes replaces the existing notes when non-empty; otherwise notes are kept
     * @throws NotFoundException if the subject has no register or the register has no such risk
     */
    public Risk updateStatus(String subjectId, String riskId, RiskStatus status, String notes) {
        return locks.withLock(subjectId, () -> {
            RiskRegister register = registerRepository.findFirstBySubjectId(subjectId)
                    .orElseThrow(() -> new NotFoundException("Risk register not found"));

            List<Risk> risks = new ArrayList<>(register.risks());
            int index = indexOf(risks, riskId);
            if (index < 0) {
                throw new NotFoundException("Risk not found");
            }
            Risk updated = risks.get(index).withStatus(status, notes);
            risks.set(index, updated);

            registerRepository.save(register.withRisks(risks, Instant.now(clock)));
            log.info("Risk {} of {} moved to {}", riskId, subjectId, status.value());
            return updated;
        });
    }

    private static int indexOf(List<Risk> risks, String riskId) {
        for (int i = 0; i < risks.size(); i++) {
            if (risks.get(i).riskId().equals(riskId)) return i;
        }
        return -1;
    }
}
