package io.jobsite.core.approval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import io.jobsite.core.TestcontainersConfiguration;
import io.jobsite.core.audit.AuditEvent;
import io.jobsite.core.audit.AuditService;
import io.jobsite.core.member.CustomRole;
import io.jobsite.core.member.CustomRoleRepository;
import io.jobsite.core.member.Member;
import io.jobsite.core.member.MemberCustomRole;
import io.jobsite.core.member.MemberCustomRoleRepository;
import io.jobsite.core.member.MemberRepository;
import io.jobsite.core.member.ProjectMember;
import io.jobsite.core.member.ProjectMemberRepository;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.JwtRequestPostProcessor;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class ApprovalFlowIntegrationTest {

  @Autowired private MockMvc mockMvc;
  @Autowired private MemberRepository memberRepository;
  @Autowired private ProjectMemberRepository projectMemberRepository;
  @Autowired private CustomRoleRepository customRoleRepository;
  @Autowired private MemberCustomRoleRepository memberCustomRoleRepository;
  @Autowired private ApprovalActionRepository actionRepository;
  @Autowired private AuditService auditService;

  private UUID companyId;
  private UUID projectId;
  private UUID foremanId;
  private UUID ownerId;
  private UUID workerId;

  @BeforeEach
  void seedMembers() {
    companyId = UUID.randomUUID();
    projectId = UUID.randomUUID();
    foremanId = seedMember("foreman");
    ownerId = seedMember("owner");
    workerId = seedMember("worker");
  }

  @Test
  void twoStepWorkflow_foremanThenOwnerApproval_completesRequest() throws Exception {
    String requestId = startRequest(createTwoStepWorkflow());

    mockMvc
        .perform(get("/api/approval-requests/{id}/can-approve", requestId).with(asMember(ownerId)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.canApprove").value(false));

    advance(requestId, foremanId, "APPROVE")
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("PENDING"))
        .andExpect(jsonPath("$.currentStep").value(2));

    advance(requestId, ownerId, "APPROVE")
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("APPROVED"));

    mockMvc
        .perform(get("/api/approval-requests/{id}/actions", requestId).with(asMember(workerId)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(2))
        .andExpect(jsonPath("$[0].action").value("APPROVE"))
        .andExpect(jsonPath("$[1].stepOrder").value(2));

    assertThat(auditService.findForEntity("approval_request", UUID.fromString(requestId)))
        .extracting(AuditEvent::getEventType)
        .containsExactlyInAnyOrder(
            "approval_request.created",
            "approval_request.step_advanced",
            "approval_request.approved");
  }

  @Test
  void rejectedRequest_cannotBeApprovedLater() throws Exception {
    String requestId = startRequest(createTwoStepWorkflow());

    advance(requestId, foremanId, "REJECT")
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("REJECTED"))
        .andExpect(jsonPath("$.currentStep").value(1));

    advance(requestId, ownerId, "APPROVE").andExpect(status().isForbidden());

    assertThat(actionRepository.findByRequestIdOrderByCreatedAtAsc(UUID.fromString(requestId)))
        .hasSize(1);
  }

  @Test
  void nonApprover_isForbiddenAndCanStillComment() throws Exception {
    String requestId = startRequest(createTwoStepWorkflow());

    advance(requestId, workerId, "APPROVE").andExpect(status().isForbidden());
    advance(requestId, workerId, "COMMENT")
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("PENDING"))
        .andExpect(jsonPath("$.currentStep").value(1));
  }

  @Test
  void resolveApprovers_returnsProjectMembersHoldingTheRole() throws Exception {
    String workflowId = createTwoStepWorkflow();
    var workflow =
        mockMvc
            .perform(get("/api/approval-workflows/{id}", workflowId).with(asMember(workerId)))
            .andExpect(status().isOk())
            .andReturn();
    String stepId =
        JsonPath.read(workflow.getResponse().getContentAsString(), "$.steps[0].id");

    mockMvc
        .perform(
            get("/api/approval-steps/{stepId}/approvers", stepId)
                .param("projectId", projectId.toString())
                .with(asMember(workerId)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.approverIds.length()").value(1))
        .andExpect(jsonPath("$.approverIds[0]").value(foremanId.toString()));
  }

  @Test
  void customRoleStep_acceptsGlobalAndProjectScopedHolders() throws Exception {
    var safetyLead = customRoleRepository.save(new CustomRole(companyId, "Safety lead"));
    memberCustomRoleRepository.save(new MemberCustomRole(workerId, safetyLead.getId(), projectId));
    memberCustomRoleRepository.save(new MemberCustomRole(ownerId, safetyLead.getId(), null));
    memberCustomRoleRepository.save(
        new MemberCustomRole(foremanId, safetyLead.getId(), UUID.randomUUID()));
    var result =
        mockMvc
            .perform(
                post("/api/approval-workflows")
                    .with(asAdmin())
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"name": "Safety plan", "workflowType": "DOCUMENT", "steps": [
                          {"stepOrder": 1, "name": "Safety lead", "approverType": "custom_role",
                           "approverCustomRoleId": "%s"}
                        ]}
                        """
                            .formatted(safetyLead.getId())))
            .andExpect(status().isCreated())
            .andReturn();
    String workflowId = JsonPath.read(result.getResponse().getContentAsString(), "$.id");
    String stepId = JsonPath.read(result.getResponse().getContentAsString(), "$.steps[0].id");

    mockMvc
        .perform(
            get("/api/approval-steps/{stepId}/approvers", stepId)
                .param("projectId", projectId.toString())
                .with(asMember(workerId)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.approverIds.length()").value(2));

    String requestId = startRequest(workflowId);
    advance(requestId, foremanId, "APPROVE").andExpect(status().isForbidden());
    advance(requestId, workerId, "APPROVE")
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("APPROVED"));
  }

  @Test
  void softDeletedForeman_isNoLongerAnApprover() throws Exception {
    String requestId = startRequest(createTwoStepWorkflow());
    var foreman = memberRepository.findById(foremanId).orElseThrow();
    foreman.softDelete();
    memberRepository.save(foreman);

    mockMvc
        .perform(
            get("/api/approval-requests/{id}/can-approve", requestId)
                .param("memberId", foremanId.toString())
                .with(asMember(workerId)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.canApprove").value(false));
    advance(requestId, foremanId, "APPROVE").andExpect(status().isForbidden());
  }

  @Test
  void memberOfAnotherCompany_cannotSeeOrTouchRequests() throws Exception {
    String workflowId = createTwoStepWorkflow();
    String requestId = startRequest(workflowId);
    var workflow =
        mockMvc
            .perform(get("/api/approval-workflows/{id}", workflowId).with(asMember(workerId)))
            .andReturn();
    String stepId =
        JsonPath.read(workflow.getResponse().getContentAsString(), "$.steps[0].id");
    var outsider = asMemberOf(UUID.randomUUID(), UUID.randomUUID());

    mockMvc
        .perform(get("/api/approval-requests/{id}", requestId).with(outsider))
        .andExpect(status().isNotFound());
    mockMvc
        .perform(get("/api/approval-requests/{id}/actions", requestId).with(outsider))
        .andExpect(status().isNotFound());
    mockMvc
        .perform(get("/api/approval-requests/{id}/can-approve", requestId).with(outsider))
        .andExpect(status().isNotFound());
    mockMvc
        .perform(
            post("/api/approval-requests/{id}/actions", requestId)
                .with(outsider)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"decision\": \"COMMENT\", \"notes\": \"hi\"}"))
        .andExpect(status().isNotFound());
    mockMvc
        .perform(
            get("/api/approval-steps/{stepId}/approvers", stepId)
                .param("projectId", projectId.toString())
                .with(outsider))
        .andExpect(status().isNotFound());
    mockMvc
        .perform(
            post("/api/approval-requests")
                .with(outsider)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"workflowId": "%s", "projectId": "%s", "entityType": "submittal",
                     "entityId": "%s"}
                    """
                        .formatted(workflowId, projectId, UUID.randomUUID())))
        .andExpect(status().isNotFound());

    assertThat(actionRepository.findByRequestIdOrderByCreatedAtAsc(UUID.fromString(requestId)))
        .isEmpty();
  }

  @Test
  void createWorkflow_unknownApproverType_returns400() throws Exception {
    mockMvc
        .perform(
            post("/api/approval-workflows")
                .with(asAdmin())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name": "Legacy", "workflowType": "DOCUMENT", "steps": [
                      {"stepOrder": 1, "name": "Review", "approverType": "group"}
                    ]}
                    """))
        .andExpect(status().isBadRequest());
  }

  private String createTwoStepWorkflow() throws Exception {
    var result =
        mockMvc
            .perform(
                post("/api/approval-workflows")
                    .with(asAdmin())
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"name": "Submittal review", "workflowType": "SUBMITTAL", "steps": [
                          {"stepOrder": 1, "name": "Foreman", "approverType": "role",
                           "approverRole": "foreman"},
                          {"stepOrder": 2, "name": "Owner", "approverType": "role",
                           "approverRole": "owner"}
                        ]}
                        """))
            .andExpect(status().isCreated())
            .andReturn();
    return JsonPath.read(result.getResponse().getContentAsString(), "$.id");
  }

  private String startRequest(String workflowId) throws Exception {
    var result =
        mockMvc
            .perform(
                post("/api/approval-requests")
                    .with(asMember(workerId))
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"workflowId": "%s", "projectId": "%s", "entityType": "submittal",
                         "entityId": "%s"}
                        """
                            .formatted(workflowId, projectId, UUID.randomUUID())))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.status").value("PENDING"))
            .andExpect(jsonPath("$.currentStep").value(1))
            .andReturn();
    return JsonPath.read(result.getResponse().getContentAsString(), "$.id");
  }

  private ResultActions advance(
      String requestId, UUID actorId, String decision) throws Exception {
    return mockMvc.perform(
        post("/api/approval-requests/{id}/actions", requestId)
            .with(asMember(actorId))
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"decision\": \"%s\"}".formatted(decision)));
  }

  private UUID seedMember(String defaultRole) {
    String email = defaultRole + "@" + companyId + ".test";
    var member = memberRepository.save(new Member(companyId, email, defaultRole, defaultRole));
    projectMemberRepository.save(new ProjectMember(projectId, member.getId(), null));
    return member.getId();
  }

  private JwtRequestPostProcessor asMember(UUID memberId) {
    return asMemberOf(memberId, companyId);
  }

  private JwtRequestPostProcessor asMemberOf(UUID memberId, UUID memberCompanyId) {
    return jwt()
        .jwt(
            j ->
                j.subject(memberId.toString())
                    .claim("company_id", memberCompanyId.toString())
                    .claim("role", "member"))
        .authorities(List.of(new SimpleGrantedAuthority("ROLE_COMPANY_MEMBER")));
  }

  private JwtRequestPostProcessor asAdmin() {
    return jwt()
        .jwt(
            j ->
                j.subject(UUID.randomUUID().toString())
                    .claim("company_id", companyId.toString())
                    .claim("role", "admin"))
        .authorities(List.of(new SimpleGrantedAuthority("ROLE_COMPANY_ADMIN")));
  }
}
