package com.complypilot.catalog;

import com.complypilot.model.ComplianceCategory;
import com.complypilot.model.Question;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.complypilot.model.ComplianceCategory.CYBER_ESSENTIALS;
import static com.complypilot.model.ComplianceCategory.GDPR;

/**
 * Immutable catalog of weighted UK SME compliance questions (GDPR and Cyber Essentials).
 * Iteration order is the catalog order used for scoring and gap ordering.
 */
public final class QuestionCatalog {

    private static final List<Question> UK_SME_QUESTIONS = List.of(
            q("gdpr_1", GDPR, "Data Inventory",
                    "Do you maintain a record of all personal data you collect and process?", 3,
                    "Article 30 of GDPR requires maintaining records of processing activities."),
            q("gdpr_2", GDPR, "Lawful Basis",
                    "Have you identified and documented a lawful basis for each processing activity?", 3,
                    "You must have a valid lawful basis under Article 6 for processing personal data."),
            q("gdpr_3", GDPR, "Privacy Notice",
                    "Do you have a clear, accessible privacy notice that explains how you use personal data?", 2,
                    "Articles 13-14 require transparent communication about data processing."),
            q("gdpr_4", GDPR, "Consent",
                    "Where you rely on consent, can individuals easily withdraw it?", 2,
                    "Consent must be freely given, specific, informed, and unambiguous."),
            q("gdpr_5", GDPR, "Data Subject Rights",
                    "Do you have procedures to respond to data subject access requests within 30 days?", 3,
                    "Individuals have the right to access their personal data under Article 15."),
            q("gdpr_6", GDPR, "Data Subject Rights",
                    "Can you fulfil requests to erase personal data (right to be forgotten)?", 2,
                    "Article 17 gives individuals the right to erasure in certain circumstances."),
            q("gdpr_7", GDPR, "Data Retention",
                    "Do you have a data retention policy specifying how long you keep personal data?", 2,
                    "Personal data should not be kept longer than necessary for the purposes for which it is processed."),
            q("gdpr_8", GDPR, "Data Security",
                    "Have you implemented appropriate technical measures to protect personal data?", 3,
                    "Article 32 requires implementing appropriate technical and organisational security measures."),
            q("gdpr_9", GDPR, "Data Security",
                    "Do you encrypt personal data in transit and at rest?", 2,
                    "Encryption is a recommended security measure under GDPR."),
            q("gdpr_10", GDPR, "Breach Response",
                    "Do you have a data breach response procedure in place?", 3,
                    "You must report certain breaches to the ICO within 72 hours under Article 33."),
            q("gdpr_11", GDPR, "DPO",
                    "Have you assessed whether you need to appoint a Data Protection Officer?", 1,
                    "Article 37 specifies when a DPO is required."),
            q("gdpr_12", GDPR, "International Transfers",
                    "Do you have appropriate safeguards for transferring personal data outside the UK?", 2,
                    "International transfers require adequate protection mechanisms."),
            q("gdpr_13", GDPR, "Staff Training",
                    "Do all staff who handle personal data receive data protection training?", 2,
                    "Staff awareness is a key organisational measure for compliance."),
            q("gdpr_14", GDPR, "Third Parties",
                    "Do you have written contracts with all processors who handle personal data on your behalf?", 3,
                    "Article 28 requires contracts with data processors specifying processing terms."),
            q("gdpr_15", GDPR, "DPIA",
                    "Do you conduct Data Protection Impact Assessments for high-risk processing?", 2,
                    "DPIAs are required under Article 35 for processing likely to result in high risk."),
            q("ce_1", CYBER_ESSENTIALS, "Firewalls",
                    "Do you have a properly configured firewall protecting your network boundary?", 3,
                    "Firewalls are the first line of defence against network attacks."),
            q("ce_2", CYBER_ESSENTIALS, "Firewalls",
                    "Are all firewall rules documented and reviewed regularly?", 2,
                    "Regular reviews ensure firewall rules remain appropriate and secure."),
            q("ce_3", CYBER_ESSENTIALS, "Secure Configuration",
                    "Do you remove or disable unnecessary user accounts?", 2,
                    "Reducing attack surface by removing unused accounts."),
            q("ce_4", CYBER_ESSENTIALS, "Secure Configuration",
                    "Do you change default passwords on all devices and software?", 3,
                    "Default credentials are a common attack vector."),
            q("ce_5", CYBER_ESSENTIALS, "Secure Configuration",
                    "Is auto-run disabled for media and network drives?", 2,
                    "Prevents automatic execution of malicious code."),
            q("ce_6", CYBER_ESSENTIALS, "Access Control",
                    "Do users only have access to the data and systems they need for their role?", 3,
                    "Principle of least privilege reduces risk of data breaches."),
            q("ce_7", CYBER_ESSENTIALS, "Access Control",
                    "Do you use multi-factor authentication for accessing cloud services?", 3,
                    "MFA significantly reduces the risk of account compromise."),
            q("ce_8", CYBER_ESSENTIALS, "Access Control",
                    "Are administrator accounts separate from normal user accounts?", 2,
                    "Separation prevents privilege escalation attacks."),
            q("ce_9", CYBER_ESSENTIALS, "Malware Protection",
                    "Is anti-malware software installed on all devices?", 3,
                    "Essential protection against viruses and malware."),
            q("ce_10", CYBER_ESSENTIALS, "Malware Protection",
                    "Is your anti-malware software set to update automatically?", 2,
                    "Regular updates ensure protection against new threats."),
            q("ce_11", CYBER_ESSENTIALS, "Malware Protection",
                    "Is your anti-malware software configured to scan files automatically?", 2,
                    "Automatic scanning catches threats before they execute."),
            q("ce_12", CYBER_ESSENTIALS, "Patch Management",
                    "Are operating systems set to update automatically?", 3,
                    "Patching fixes known vulnerabilities that attackers exploit."),
            q("ce_13", CYBER_ESSENTIALS, "Patch Management",
                    "Do you apply high-risk security patches within 14 days of release?", 3,
                    "Timely patching is critical for preventing exploitation."),
            q("ce_14", CYBER_ESSENTIALS, "Patch Management",
                    "Do you remove unsupported software from your systems?", 2,
                    "Unsupported software no longer receives security updates."),
            q("ce_15", CYBER_ESSENTIALS, "Password Policy",
                    "Do you enforce a minimum password length of at least 12 characters?", 2,
                    "Longer passwords are significantly harder to crack.")
    );

    private final List<Question> questions;
    private final Map<String, Question> byId;

    public QuestionCatalog(List<Question> questions) {
        this.questions = List.copyOf(questions);
        this.byId = this.questions.stream()
                .collect(Collectors.toUnmodifiableMap(Question::id, Function.identity()));
    }

    /** The standard UK SME questionnaire. */
    public static QuestionCatalog ukSme() {
        return new QuestionCatalog(UK_SME_QUESTIONS);
    }

    public List<Question> questions() {
        return questions;
    }

    public Optional<Question> find(String questionId) {
        return Optional.ofNullable(byId.get(questionId));
    }

    public List<Question> byCategory(ComplianceCategory category) {
        return questions.stream().filter(q -> q.category() == category).toList();
    }

    /** Question count per category label; every category is present, possibly with 0. */
    public Map<String, Long> countsByCategory() {
        return Arrays.stream(ComplianceCategory.values())
                .collect(Collectors.toMap(ComplianceCategory::label,
                        c -> questions.stream().filter(q -> q.category() == c).count(),
                        (a, b) -> a, LinkedHashMap::new));
    }

    private static Question q(String id, ComplianceCategory category, String subcategory,
                              String text, int weight, String guidance) {
        return new Question(id, category, subcategory, text, weight, guidance);
    }
}
