package com.complypilot.service;

import com.complypilot.catalog.RiskTemplateLibrary;
import com.complypilot.exception.NotFoundException;
import com.complypilot.model.Risk;
import com.complypilot.model.RiskRegister;
import com.complypilot.model.RiskStatus;
import com.complypilot.model.RiskTemplateEntry;
import com.complypilot.model.User;
import com.complypilot.repository.RiskRegisterRepository;
import com.complypilot.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class RiskRegisterServiceTest {

    private static final String SUBJECT = "user_abc123def456";

    private final RiskTemplateLibrary library = RiskTemplateLibrary.ukSme();
    private final List<RiskRegister> store = new ArrayList<>();

    private RiskRegisterRepository registerRepository;
    private UserRepository userRepository;
    private RiskRegisterService service;

    @BeforeEach
    void setUp() {
        registerRepository = mock(RiskRegisterRepository.class);
        userRepository = mock(UserRepository.class);

        // document-store semantics backed by a list
        when(registerRepository.save(any(RiskRegister.class))).thenAnswer(inv -> {
            RiskRegister register = inv.getArgument(0);
            store.removeIf(r -> r.id().equals(register.id()));
            store.add(register);
            return register;
        });
        when(registerRepository.deleteBySubjectId(anyString())).thenAnswer(inv -> {
            String subjectId = inv.getArgument(0);
            long before = store.size();
            store.removeIf(r -> r.subjectId().equals(subjectId));
            return before - store.size();
        });
        when(registerRepository.findFirstBySubjectId(anyString())).thenAnswer(inv ->
                store.stream().filter(r -> r.subjectId().equals(inv.getArgument(0))).findFirst());

        when(userRepository.findById(SUBJECT)).thenReturn(Optional.of(
                new User(SUBJECT, "owner@shop.co.uk", "Owner", null, "Shop Ltd", null, 12, null, Instant.EPOCH)));

        service = new RiskRegisterService(library, registerRepository, userRepository, new SubjectLocks(),
                Clock.fixed(Instant.parse("2026-05-01T09:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void generatesRetailRegisterWithFreshRiskIds() {
        RiskRegister register = service.generate(SUBJECT, "Retail", "E-commerce");

        assertEquals(5, register.risks().size());
        assertEquals(5, register.totalRisks());
        assertEquals("Retail", register.businessType());
        assertEquals("E-commerce", register.industry());

        Set<String> templateIds = library.templateFor("retail").stream()
                .map(RiskTemplateEntry::riskId)
                .collect(Collectors.toSet());
        Set<String> riskIds = register.risks().stream().map(Risk::riskId).collect(Collectors.toSet());
        assertEquals(5, riskIds.size());
        riskIds.forEach(id -> assertFalse(templateIds.contains(id), id));

        register.risks().forEach(risk -> {
            assertEquals(RiskStatus.IDENTIFIED, risk.status());
            assertNull(risk.owner());
            assertNull(risk.dueDate());
            assertNull(risk.notes());
        });
        assertEquals("Customer Payment Data Breach", register.risks().get(0).title());
    }

    @Test
    void unknownBusinessTypeYieldsGeneralRisks() {
        List<String> unknown = service.generate(SUBJECT, "Space Tourism", null).risks().stream()
                .map(Risk::title).toList();
        List<String> general = service.generate(SUBJECT, "general", null).risks().stream()
                .map(Risk::title).toList();

        assertEquals(general, unknown);
    }

    @Test
    void secondGenerateReplacesTheRegister() {
        service.generate(SUBJECT, "Retail", null);
        RiskRegister replacement = service.generate(SUBJECT, "Healthcare", "Dental");

        assertEquals(1, store.size());
        assertEquals(replacement.id(), store.get(0).id());
        assertEquals(5, service.get(SUBJECT).orElseThrow().risks().size());
        assertEquals("Patient Record Breach", service.get(SUBJECT).orElseThrow().risks().get(0).title());

        InOrder inOrder = inOrder(registerRepository);
        inOrder.verify(registerRepository).deleteBySubjectId(SUBJECT);
        inOrder.verify(registerRepository).save(any(RiskRegister.class));
    }

    @Test
    void generateUpdatesSubjectBusinessProfile() {
        service.generate(SUBJECT, "Technology", "SaaS");

        ArgumentCaptor<User> saved = ArgumentCaptor.forClass(User.class);
        verify(userRepository).save(saved.capture());
        assertEquals("Technology", saved.getValue().businessType());
        assertEquals("SaaS", saved.getValue().industry());
        assertEquals("Shop Ltd", saved.getValue().companyName());
    }

    @Test
    void getReturnsEmptyWithoutRegister() {
        assertTrue(service.get(SUBJECT).isEmpty());
    }

    @Test
    void updateStatusSetsStatusAndNotes() {
        RiskRegister register = service.generate(SUBJECT, "Retail", null);
        String riskId = register.risks().get(2).riskId();

        Risk updated = service.updateStatus(SUBJECT, riskId, RiskStatus.MITIGATING, "Consent platform ordered");

        assertEquals(RiskStatus.MITIGATING, updated.status());
        assertEquals("Consent platform ordered", updated.notes());
        RiskRegister stored = service.get(SUBJECT).orElseThrow();
        assertEquals(RiskStatus.MITIGATING, stored.risks().get(2).status());
        assertEquals(Instant.parse("2026-05-01T09:00:00Z"), stored.updatedAt());
        assertEquals(RiskStatus.IDENTIFIED, stored.risks().get(0).status());
    }

    @Test
    void updateStatusWithoutNotesKeepsExistingNotes() {
        String riskId = service.generate(SUBJECT, "Retail", null).risks().get(0).riskId();
        service.updateStatus(SUBJECT, riskId, RiskStatus.MITIGATING, "PCI review booked");

        Risk withoutNotes = service.updateStatus(SUBJECT, riskId, RiskStatus.RESOLVED, null);
        Risk withEmptyNotes = service.updateStatus(SUBJECT, riskId, RiskStatus.ACCEPTED, "");

        assertEquals("PCI review booked", withoutNotes.notes());
        assertEquals("PCI review booked", withEmptyNotes.notes());
        assertEquals(RiskStatus.ACCEPTED, withEmptyNotes.status());
    }

    @Test
    void anyStatusCanFollowAnyOther() {
        String riskId = service.generate(SUBJECT, "Retail", null).risks().get(0).riskId();

        for (RiskStatus from : RiskStatus.values()) {
            for (RiskStatus to : RiskStatus.values()) {
                service.updateStatus(SUBJECT, riskId, from, null);
                assertEquals(to, service.updateStatus(SUBJECT, riskId, to, null).status());
            }
        }
    }

    @Test
    void updateStatusOfUnknownRiskFailsAndLeavesRegisterUnchanged() {
        RiskRegister register = service.generate(SUBJECT, "Retail", null);
        String templateId = "retail_1";

        assertThrows(NotFoundException.class,
                () -> service.updateStatus(SUBJECT, templateId, RiskStatus.RESOLVED, "done"));

        assertEquals(register, service.get(SUBJECT).orElseThrow());
        verify(registerRepository, times(1)).save(any(RiskRegister.class));
    }

    @Test
    void updateStatusWithoutRegisterFails() {
        NotFoundException e = assertThrows(NotFoundException.class,
                () -> service.updateStatus(SUBJECT, "anything", RiskStatus.RESOLVED, null));
        assertEquals("Risk register not found", e.getMessage());
    }
}
