package me.golemcore.actions.adapter.inbound.web.controller;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */


import lombok.RequiredArgsConstructor;
import me.golemcore.actions.adapter.inbound.web.dto.ScheduledActionDto;
import me.golemcore.actions.adapter.inbound.web.dto.TestActionResponse;
import me.golemcore.actions.adapter.inbound.web.dto.TimerStatusDto;
import me.golemcore.actions.adapter.inbound.web.dto.ToggleRequest;
import me.golemcore.actions.domain.model.ScheduledAction;
import me.golemcore.actions.domain.model.ScheduledActionForm;
import me.golemcore.actions.domain.model.ScheduledActionUpdate;
import me.golemcore.actions.domain.model.TimerStatus;
import me.golemcore.actions.domain.service.ScheduledActionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;

/**
 * Scheduled action management endpoints.
 *
 * <p>
 * The caller is identified by the {@code X-User-Id} header set by the
 * upstream gateway; {@code X-User-Role: admin} grants access to every user's
 * actions.
 */
@RestController
@RequestMapping("/api/scheduled-actions")
@RequiredArgsConstructor
public class ScheduledActionsController {

    static final String USER_HEADER = "X-User-Id";
    static final String ROLE_HEADER = "X-User-Role";
    private static final String ROLE_ADMIN = "admin";

    private final ScheduledActionService actionService;

    @GetMapping
    public Mono<ResponseEntity<List<ScheduledActionDto>>> listOwn(
            @RequestHeader(value = USER_HEADER, required = false) String userId) {
        String owner = requireUser(userId);
        List<ScheduledActionDto> actions = actionService.listByOwner(owner).stream()
                .map(this::toDto)
                .toList();
        return Mono.just(ResponseEntity.ok(actions));
    }

    @GetMapping("/all")
    public Mono<ResponseEntity<List<ScheduledActionDto>>> listAll(
            @RequestHeader(value = USER_HEADER, required = false) String userId,
            @RequestHeader(value = ROLE_HEADER, required = false) String role) {
        requireUser(userId);
        if (!isAdmin(role)) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "Admin access required");
        }
        List<ScheduledActionDto> actions = actionService.listAll().stream()
                .map(this::toDto)
                .toList();
        return Mono.just(ResponseEntity.ok(actions));
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<ScheduledActionDto>> get(
            @PathVariable String id,
            @RequestHeader(value = USER_HEADER, required = false) String userId,
            @RequestHeader(value = ROLE_HEADER, required = false) String role) {
        ScheduledAction action = requireAccessible(id, userId, role);
        return Mono.just(ResponseEntity.ok(toDto(action)));
    }

    @PostMapping
    public Mono<ResponseEntity<ScheduledActionDto>> create(
            @RequestBody ScheduledActionForm form,
            @RequestHeader(value = USER_HEADER, required = false) String userId) {
        String owner = requireUser(userId);
        ScheduledAction created = actionService.create(owner, form);
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(toDto(created)));
    }

    @PutMapping("/{id}")
    public Mono<ResponseEntity<ScheduledActionDto>> update(
            @PathVariable String id,
            @RequestBody ScheduledActionUpdate update,
            @RequestHeader(value = USER_HEADER, required = false) String userId,
            @RequestHeader(value = ROLE_HEADER, required = false) String role) {
        requireAccessible(id, userId, role);
        ScheduledAction updated = actionService.update(id, update).orElseThrow(ScheduledActionsController::notFound);
        return Mono.just(ResponseEntity.ok(toDto(updated)));
    }

    @PostMapping("/{id}/toggle")
    public Mono<ResponseEntity<ScheduledActionDto>> toggle(
            @PathVariable String id,
            @RequestBody ToggleRequest request,
            @RequestHeader(value = USER_HEADER, required = false) String userId,
            @RequestHeader(value = ROLE_HEADER, required = false) String role) {
        requireAccessible(id, userId, role);
        if (request == null || request.enabled() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "enabled is required");
        }
        ScheduledAction updated = actionService.toggle(id, request.enabled())
                .orElseThrow(ScheduledActionsController::notFound);
        return Mono.just(ResponseEntity.ok(toDto(updated)));
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<Map<String, Object>>> delete(
            @PathVariable String id,
            @RequestHeader(value = USER_HEADER, required = false) String userId,
            @RequestHeader(value = ROLE_HEADER, required = false) String role) {
        requireAccessible(id, userId, role);
        boolean deleted = actionService.delete(id);
        return Mono.just(ResponseEntity.ok(Map.of("id", id, "deleted", deleted)));
    }

    @PostMapping("/{id}/test")
    public Mono<ResponseEntity<TestActionResponse>> test(
            @PathVariable String id,
            @RequestHeader(value = USER_HEADER, required = false) String userId,
            @RequestHeader(value = ROLE_HEADER, required = false) String role) {
        ScheduledAction action = requireAccessible(id, userId, role);
        // Search and LLM calls block; keep them off the event loop.
        return Mono.fromCallable(() -> actionService.test(action))
                .subscribeOn(Schedulers.boundedElastic())
                .map(result -> ResponseEntity.ok(new TestActionResponse("success", result)));
    }

    @GetMapping("/{id}/status")
    public Mono<ResponseEntity<TimerStatusDto>> status(
            @PathVariable String id,
            @RequestHeader(value = USER_HEADER, required = false) String userId,
            @RequestHeader(value = ROLE_HEADER, required = false) String role) {
        requireAccessible(id, userId, role);
        TimerStatus status = actionService.status(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Action is not scheduled"));
        return Mono.just(ResponseEntity.ok(new TimerStatusDto(status.actionId(), status.name(),
                status.nextFireTime().toString(), status.trigger())));
    }

    private ScheduledAction requireAccessible(String id, String userId, String role) {
        String caller = requireUser(userId);
        ScheduledAction action = actionService.find(id).orElseThrow(ScheduledActionsController::notFound);
        if (!caller.equals(action.getOwner()) && !isAdmin(role)) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "Access denied");
        }
        return action;
    }

    private static String requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, USER_HEADER + " header is required");
        }
        return userId.trim();
    }

    private static boolean isAdmin(String role) {
        return role != null && ROLE_ADMIN.equalsIgnoreCase(role.trim());
    }

    private static ResponseStatusException notFound() {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Scheduled action not found");
    }

    private ScheduledActionDto toDto(ScheduledAction action) {
        String nextFireTime = actionService.status(action.getId())
                .map(status -> status.nextFireTime().toString())
                .orElse(null);
        return ScheduledActionDto.builder()
                .id(action.getId())
                .owner(action.getOwner())
                .name(action.getName())
                .description(action.getDescription())
                .actionType(action.getActionType())
                .actionConfig(action.getActionConfig())
                .scheduleType(action.getScheduleType())
                .scheduleConfig(action.getScheduleConfig())
                .enabled(action.isEnabled())
                .lastRunAt(action.getLastRunAt())
                .nextRunAt(action.getNextRunAt())
                .createdAt(action.getCreatedAt())
                .updatedAt(action.getUpdatedAt())
                .nextFireTime(nextFireTime)
                .build();
    }
}
