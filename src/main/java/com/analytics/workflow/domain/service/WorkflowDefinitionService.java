package com.analytics.workflow.domain.service;

import com.analytics.workflow.domain.exception.ValidationException;
import com.analytics.workflow.domain.exception.WorkflowNotFoundException;
import com.analytics.workflow.domain.model.TenantContext;
import com.analytics.workflow.domain.model.WorkflowDefinitionRequest;
import com.analytics.workflow.domain.model.WorkflowDefinitionResponse;
import com.analytics.workflow.infrastructure.persistence.entity.WorkflowDefinitionEntity;
import com.analytics.workflow.infrastructure.persistence.repository.WorkflowDefinitionRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * CRUD of workflow definitions, scoped to the calling tenant.
 * 
 * Config and schedule are validated before anything is stored; every
 * write re-registers the workflow's cron trigger.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WorkflowDefinitionService {
    
    private final WorkflowDefinitionRepository definitionRepository;
    private final WorkflowConfigParser configParser;
    private final WorkflowScheduler workflowScheduler;
    private final ObjectMapper objectMapper;
    
    @Transactional
    public WorkflowDefinitionResponse create(TenantContext tenant, WorkflowDefinitionRequest request) {
        validate(request);
        
        WorkflowDefinitionEntity definition = WorkflowDefinitionEntity.builder()
                .tenantId(tenant.getTenantId())
                .teamId(request.getTeamId() != null ? request.getTeamId() : tenant.getTeamId())
                .sharedTeamIds(copy(request.getSharedTeamIds()))
                .name(request.getName().trim())
                .description(request.getDescription())
                .enabled(request.isEnabledOrDefault())
                .schedule(blankToNull(request.getSchedule()))
                .config(writeConfig(request))
                .build();
        
        definition = definitionRepository.save(definition);
        workflowScheduler.register(definition);
        
        log.info("Workflow created: {} '{}' (tenant: {})", definition.getId(), definition.getName(), tenant.getTenantId());
        return toResponse(definition);
    }
    
    @Transactional
    public WorkflowDefinitionResponse update(TenantContext tenant, String workflowId, WorkflowDefinitionRequest request) {
        validate(request);
        WorkflowDefinitionEntity definition = findEntity(tenant, workflowId);
        
        definition.setName(request.getName().trim());
        definition.setDescription(request.getDescription());
        definition.setEnabled(request.isEnabledOrDefault());
        definition.setSchedule(blankToNull(request.getSchedule()));
        definition.setConfig(writeConfig(request));
        if (request.getTeamId() != null) {
            definition.setTeamId(request.getTeamId());
        }
        if (request.getSharedTeamIds() != null) {
            definition.setSharedTeamIds(copy(request.getSharedTeamIds()));
        }
        
        definition = definitionRepository.save(definition);
        workflowScheduler.register(definition);
        
        log.info("Workflow updated: {} (tenant: {})", definition.getId(), tenant.getTenantId());
        return toResponse(definition);
    }
    
    /**
     * Deleting a workflow with a running execution ends that run FAILED at
     * its next day boundary.
     */
    @Transactional
    public void delete(TenantContext tenant, String workflowId) {
        WorkflowDefinitionEntity definition = findEntity(tenant, workflowId);
        workflowScheduler.unregister(definition.getId());
        definitionRepository.delete(definition);
        log.info("Workflow deleted: {} (tenant: {})", definition.getId(), tenant.getTenantId());
    }
    
    @Transactional(readOnly = true)
    public WorkflowDefinitionResponse get(TenantContext tenant, String workflowId) {
        return toResponse(findEntity(tenant, workflowId));
    }
    
    @Transactional(readOnly = true)
    public List<WorkflowDefinitionResponse> list(TenantContext tenant) {
        return definitionRepository.findByTenantIdOrderByCreatedAtDesc(tenant.getTenantId()).stream()
                .filter(definition -> definition.isVisibleTo(tenant.getTeamId()))
                .map(this::toResponse)
                .collect(Collectors.toList());
    }
    
    /**
     * @throws WorkflowNotFoundException when missing, owned by another
     *         tenant or not visible to the caller's team
     */
    @Transactional(readOnly = true)
    public WorkflowDefinitionEntity findEntity(TenantContext tenant, String workflowId) {
        UUID id = Ids.parse(workflowId).orElseThrow(() -> new WorkflowNotFoundException(workflowId));
        return definitionRepository.findByIdAndTenantId(id, tenant.getTenantId())
                .filter(definition -> definition.isVisibleTo(tenant.getTeamId()))
                .orElseThrow(() -> new WorkflowNotFoundException(workflowId));
    }
    
    private void validate(WorkflowDefinitionRequest request) {
        if (request.getName() == null || request.getName().isBlank()) {
            throw new ValidationException("Workflow name is required");
        }
        configParser.parse(request.getConfig());
        String schedule = blankToNull(request.getSchedule());
        if (schedule != null) {
            WorkflowScheduler.normalizeCron(schedule);
        }
    }
    
    private String writeConfig(WorkflowDefinitionRequest request) {
        try {
            return objectMapper.writeValueAsString(request.getConfig());
        } catch (JsonProcessingException e) {
            throw new ValidationException("Workflow config could not be stored: " + e.getOriginalMessage(), e);
        }
    }
    
    private WorkflowDefinitionResponse toResponse(WorkflowDefinitionEntity definition) {
        WorkflowDefinitionResponse.WorkflowDefinitionResponseBuilder response = WorkflowDefinitionResponse.builder()
                .id(definition.getId().toString())
                .tenantId(definition.getTenantId())
                .teamId(definition.getTeamId())
                .sharedTeamIds(copy(definition.getSharedTeamIds()))
                .name(definition.getName())
                .description(definition.getDescription())
                .enabled(definition.isEnabled())
                .schedule(definition.getSchedule())
                .createdAt(definition.getCreatedAt())
                .updatedAt(definition.getUpdatedAt());
        try {
            response.config(objectMapper.readTree(definition.getConfig()));
        } catch (JsonProcessingException e) {
            log.error("Stored config of workflow {} is not valid JSON: {}", definition.getId(), e.getMessage());
            response.config(null);
        }
        return response.build();
    }
    
    private static List<String> copy(List<String> values) {
        return values == null ? new ArrayList<>() : new ArrayList<>(values);
    }
    
    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
