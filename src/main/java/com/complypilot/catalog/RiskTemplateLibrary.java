package com.complypilot.catalog;

import com.complypilot.model.RiskRating;
import com.complypilot.model.RiskTemplateEntry;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static com.complypilot.model.RiskRating.HIGH;
import static com.complypilot.model.RiskRating.LOW;
import static com.complypilot.model.RiskRating.MEDIUM;

/**
 * Starter risk templates per business type. Lookup is total: unknown business types
 * resolve to the {@value #DEFAULT_TYPE} set.
 */
public final class RiskTemplateLibrary {

    public static final String DEFAULT_TYPE = "general";

    private static final Map<String, List<RiskTemplateEntry>> UK_SME_TEMPLATES = Map.ofEntries(
            Map.entry("retail", List.of(
                    r("retail_1", "Customer Payment Data Breach",
                            "Unauthorised access to stored payment card details",
                            MEDIUM, HIGH, "Data Security",
                            "Implement PCI DSS compliance measures, tokenise card data"),
                    r("retail_2", "E-commerce Platform Vulnerability",
                            "Security vulnerabilities in online shopping systems",
                            MEDIUM, HIGH, "Cyber Security",
                            "Regular security testing, WAF implementation, secure coding practices"),
                    r("retail_3", "Customer Data Marketing Misuse",
                            "Using customer data for marketing without proper consent",
                            HIGH, MEDIUM, "GDPR Compliance",
                            "Implement consent management platform, review marketing permissions"),
                    r("retail_4", "Third-Party Delivery Partner Data Sharing",
                            "Inadequate data protection with delivery partners",
                            MEDIUM, MEDIUM, "Third Party Risk",
                            "Review contracts, implement data processing agreements"),
                    r("retail_5", "Point of Sale System Compromise",
                            "Malware infection on POS systems",
                            MEDIUM, HIGH, "Cyber Security",
                            "POS system hardening, network segmentation, regular scanning"))),
            Map.entry("professional_services", List.of(
                    r("ps_1", "Client Confidentiality Breach",
                            "Unauthorised disclosure of sensitive client information",
                            MEDIUM, HIGH, "Data Security",
                            "Access controls, encryption, staff training on confidentiality"),
                    r("ps_2", "Email Phishing Attack",
                            "Staff falling victim to sophisticated phishing attempts",
                            HIGH, HIGH, "Cyber Security",
                            "Phishing awareness training, email filtering, MFA enforcement"),
                    r("ps_3", "Document Retention Non-Compliance",
                            "Retaining client documents beyond legal requirements",
                            HIGH, MEDIUM, "GDPR Compliance",
                            "Implement retention schedules, automated deletion, regular audits"),
                    r("ps_4", "Remote Working Data Exposure",
                            "Data leakage through insecure remote working practices",
                            HIGH, MEDIUM, "Cyber Security",
                            "VPN usage, device encryption, secure file sharing policies"),
                    r("ps_5", "Subcontractor Data Handling",
                            "Inadequate data protection by subcontracted parties",
                            MEDIUM, MEDIUM, "Third Party Risk",
                            "Due diligence, contractual obligations, periodic audits"))),
            Map.entry("healthcare", List.of(
                    r("hc_1", "Patient Record Breach",
                            "Unauthorised access to sensitive health records",
                            MEDIUM, HIGH, "Data Security",
                            "Role-based access, audit logging, encryption"),
                    r("hc_2", "Medical Device Vulnerability",
                            "Security flaws in connected medical equipment",
                            MEDIUM, HIGH, "Cyber Security",
                            "Device inventory, network segmentation, patch management"),
                    r("hc_3", "Special Category Data Mishandling",
                            "Processing health data without appropriate safeguards",
                            MEDIUM, HIGH, "GDPR Compliance",
                            "Article 9 compliance review, DPIA for processing activities"),
                    r("hc_4", "Ransomware Attack",
                            "Encryption of patient records by malicious actors",
                            HIGH, HIGH, "Cyber Security",
                            "Offline backups, endpoint protection, incident response plan"),
                    r("hc_5", "Consent Management Failure",
                            "Processing patient data without valid consent",
                            MEDIUM, MEDIUM, "GDPR Compliance",
                            "Consent audit, digital consent capture, staff training"))),
            Map.entry("technology", List.of(
                    r("tech_1", "Source Code Theft",
                            "Unauthorised access to proprietary software code",
                            MEDIUM, HIGH, "Data Security",
                            "Code repository security, access controls, DLP solutions"),
                    r("tech_2", "Cloud Infrastructure Misconfiguration",
                            "Security gaps in cloud service setup",
                            HIGH, HIGH, "Cyber Security",
                            "Cloud security posture management, configuration audits"),
                    r("tech_3", "Customer Data Processing Scope Creep",
                            "Processing customer data beyond agreed purposes",
                            MEDIUM, MEDIUM, "GDPR Compliance",
                            "Data mapping, processing registers, privacy by design"),
                    r("tech_4", "API Security Breach",
                            "Exploitation of API vulnerabilities exposing data",
                            HIGH, HIGH, "Cyber Security",
                            "API security testing, authentication, rate limiting"),
                    r("tech_5", "International Data Transfer Issues",
                            "Non-compliant data transfers to overseas development teams",
                            HIGH, MEDIUM, "GDPR Compliance",
                            "SCCs, adequacy decisions, data localisation"))),
            Map.entry("manufacturing", List.of(
                    r("mfg_1", "Industrial Control System Attack",
                            "Cyber attack on operational technology systems",
                            MEDIUM, HIGH, "Cyber Security",
                            "OT/IT segregation, ICS security monitoring"),
                    r("mfg_2", "Supply Chain Data Breach",
                            "Compromise through supplier systems",
                            MEDIUM, MEDIUM, "Third Party Risk",
                            "Supplier security assessments, access restrictions"),
                    r("mfg_3", "Employee Personal Data Exposure",
                            "HR system vulnerabilities exposing staff data",
                            MEDIUM, MEDIUM, "GDPR Compliance",
                            "HR system security review, access controls"),
                    r("mfg_4", "Legacy System Vulnerabilities",
                            "Unpatched legacy systems creating security gaps",
                            HIGH, MEDIUM, "Cyber Security",
                            "Legacy system audit, upgrade planning, compensating controls"),
                    r("mfg_5", "CCTV Compliance Issues",
                            "Non-compliant use of workplace surveillance",
                            MEDIUM, LOW, "GDPR Compliance",
                            "CCTV policy review, signage, retention limits"))),
            Map.entry("general", List.of(
                    r("gen_1", "Ransomware Attack",
                            "Malicious encryption of business data",
                            HIGH, HIGH, "Cyber Security",
                            "Regular backups, endpoint protection, staff training"),
                    r("gen_2", "Phishing and Social Engineering",
                            "Staff manipulation to disclose credentials or data",
                            HIGH, HIGH, "Cyber Security",
                            "Security awareness training, email filtering, MFA"),
                    r("gen_3", "Data Subject Rights Non-Compliance",
                            "Failure to respond to data subject requests timely",
                            MEDIUM, MEDIUM, "GDPR Compliance",
                            "DSR procedures, staff training, request tracking"),
                    r("gen_4", "Third Party Data Breach",
                            "Data exposure through supplier or partner systems",
                            MEDIUM, MEDIUM, "Third Party Risk",
                            "Vendor assessments, contractual obligations, monitoring"),
                    r("gen_5", "Unencrypted Data Storage",
                            "Personal data stored without encryption",
                            MEDIUM, MEDIUM, "Data Security",
                            "Encryption at rest implementation, security audits")))
    );

    private final Map<String, List<RiskTemplateEntry>> templates;

    public RiskTemplateLibrary(Map<String, List<RiskTemplateEntry>> templates) {
        if (!templates.containsKey(DEFAULT_TYPE)) {
            throw new IllegalArgumentException("Template library requires a '" + DEFAULT_TYPE + "' set");
        }
        this.templates = Map.copyOf(templates);
    }

    public static RiskTemplateLibrary ukSme() {
        return new RiskTemplateLibrary(UK_SME_TEMPLATES);
    }

    /** Lowercases and replaces spaces with underscores, so "Professional Services" becomes professional_services. */
    public static String normalize(String businessType) {
        if (businessType == null) return DEFAULT_TYPE;
        return businessType.toLowerCase(Locale.ROOT).replace(' ', '_');
    }

    public List<RiskTemplateEntry> templateFor(String businessType) {
        List<RiskTemplateEntry> entries = templates.get(normalize(businessType));
        return entries != null ? entries : templates.get(DEFAULT_TYPE);
    }

    public Set<String> businessTypes() {
        return templates.keySet();
    }

    private static RiskTemplateEntry r(String riskId, String title, String description,
                                       RiskRating likelihood, RiskRating impact,
                                       String category, String mitigation) {
        return new RiskTemplateEntry(riskId, title, description, likelihood, impact, category, mitigation);
    }
}
