package ru.marthastudios.nudgebot.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import ru.marthastudios.nudgebot.dto.smartgroup.SmartGroupMemberDto;
import ru.marthastudios.nudgebot.dto.smartgroup.SmartGroupResolutionResultDto;
import ru.marthastudios.nudgebot.entity.SmartGroup;
import ru.marthastudios.nudgebot.entity.SmartGroupMember;
import ru.marthastudios.nudgebot.exception.ResourceNotFoundException;
import ru.marthastudios.nudgebot.pojo.AiUserMatchResult;
import ru.marthastudios.nudgebot.pojo.EnrichedUserInfo;
import ru.marthastudios.nudgebot.property.NudgeProperty;
import ru.marthastudios.nudgebot.repository.SmartGroupMemberRepository;
import ru.marthastudios.nudgebot.repository.SmartGroupRepository;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Smart groups are natural-language audience descriptions resolved to members by the AI model. Resolved
 * members are cached per group.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SmartGroupService {
    private final SmartGroupRepository smartGroupRepository;
    private final SmartGroupMemberRepository smartGroupMemberRepository;
    private final GraphUserService graphUserService;
    private final AiFoundryService aiFoundryService;
    private final NudgeProperty nudgeProperty;

    public boolean isAiEnabled() {
        return aiFoundryService.isEnabled();
    }

    @Transactional
    public SmartGroup createSmartGroup(String name, String description, String createdByUpn) {
        log.info("Creating smart group '{}' by {}", name, createdByUpn);

        SmartGroup smartGroup = SmartGroup.builder()
                .id(UUID.randomUUID().toString())
                .name(name)
                .description(description)
                .createdByUpn(createdByUpn)
                .createdDate(System.currentTimeMillis())
                .build();

        return smartGroupRepository.save(smartGroup);
    }

    public List<SmartGroup> getAllSmartGroups() {
        return smartGroupRepository.findAllByOrderByCreatedDateDesc();
    }

    public SmartGroup getSmartGroup(String groupId) {
        return smartGroupRepository.findById(groupId).orElse(null);
    }

    @Transactional
    public SmartGroup updateSmartGroup(String groupId, String name, String description) {
        log.info("Updating smart group {}", groupId);

        SmartGroup smartGroup = getExistingSmartGroup(groupId);

        smartGroup.setName(name);
        smartGroup.setDescription(description);

        return smartGroupRepository.save(smartGroup);
    }

    @Transactional
    public void deleteSmartGroup(String groupId) {
        log.info("Deleting smart group {}", groupId);

        SmartGroup smartGroup = getExistingSmartGroup(groupId);

        smartGroupMemberRepository.deleteAllBySmartGroupId(groupId);
        smartGroupRepository.delete(smartGroup);
    }

    @Transactional
    public SmartGroupResolutionResultDto resolveSmartGroupMembers(String groupId, boolean forceRefresh) {
        SmartGroup smartGroup = getExistingSmartGroup(groupId);
        long now = System.currentTimeMillis();

        if (!forceRefresh && smartGroup.getLastResolvedDate() != null
                && now - smartGroup.getLastResolvedDate() < nudgeProperty.getSmartGroupCacheAgeMs()) {
            List<SmartGroupMember> cachedMembers = smartGroupMemberRepository.findAllBySmartGroupIdOrderByIdAsc(groupId);

            if (!cachedMembers.isEmpty()) {
                log.info("Returning cached members for smart group {}", groupId);

                return SmartGroupResolutionResultDto.builder()
                        .smartGroupId(groupId)
                        .smartGroupName(smartGroup.getName())
                        .members(cachedMembers.stream().map(SmartGroupService::mapMemberToDto).toList())
                        .resolvedAt(smartGroup.getLastResolvedDate())
                        .fromCache(true)
                        .build();
            }
        }

        if (!aiFoundryService.isEnabled()) {
            throw new IllegalStateException("AI Foundry is not configured. Copilot Connected mode is disabled.");
        }

        log.info("Resolving smart group {} using AI", groupId);

        List<EnrichedUserInfo> users = graphUserService.getAllUsersWithMetadata();
        List<AiUserMatchResult> matches = aiFoundryService.resolveSmartGroupMembers(smartGroup.getDescription(), users);

        List<SmartGroupMember> members = new ArrayList<>();

        for (AiUserMatchResult match : matches) {
            EnrichedUserInfo user = findUser(users, match.getUserPrincipalName());

            members.add(SmartGroupMember.builder()
                    .smartGroupId(groupId)
                    .userPrincipalName(match.getUserPrincipalName())
                    .displayName(user != null ? user.getDisplayName() : null)
                    .department(user != null ? user.getDepartment() : null)
                    .jobTitle(user != null ? user.getJobTitle() : null)
                    .confidenceScore(match.getConfidenceScore())
                    .build());
        }

        smartGroupMemberRepository.deleteAllBySmartGroupId(groupId);
        smartGroupMemberRepository.saveAll(members);

        smartGroup.setLastResolvedDate(now);
        smartGroup.setLastResolvedMemberCount(matches.size());
        smartGroupRepository.save(smartGroup);

        log.info("Resolved smart group {}: {} members found", groupId, members.size());

        return SmartGroupResolutionResultDto.builder()
                .smartGroupId(groupId)
                .smartGroupName(smartGroup.getName())
                .members(members.stream().map(SmartGroupService::mapMemberToDto).toList())
                .resolvedAt(now)
                .fromCache(false)
                .build();
    }

    /**
     * Resolves a description without storing anything, for trying out wording.
     */
    public List<SmartGroupMemberDto> previewSmartGroupMembers(String description, int maxUsers) {
        if (!aiFoundryService.isEnabled()) {
            throw new IllegalStateException("AI Foundry is not configured. Copilot Connected mode is disabled.");
        }

        log.info("Previewing smart group resolution for: {}", description);

        List<EnrichedUserInfo> users = graphUserService.getAllUsersWithMetadata(maxUsers);
        List<AiUserMatchResult> matches = aiFoundryService.resolveSmartGroupMembers(description, users);

        List<SmartGroupMemberDto> members = new ArrayList<>();

        for (AiUserMatchResult match : matches) {
            EnrichedUserInfo user = findUser(users, match.getUserPrincipalName());

            members.add(SmartGroupMemberDto.builder()
                    .userPrincipalName(match.getUserPrincipalName())
                    .displayName(user != null ? user.getDisplayName() : null)
                    .department(user != null ? user.getDepartment() : null)
                    .jobTitle(user != null ? user.getJobTitle() : null)
                    .confidenceScore(match.getConfidenceScore())
                    .build());
        }

        return members;
    }

    public List<String> getSmartGroupUpns(String groupId) {
        return resolveSmartGroupMembers(groupId, false).getMembers().stream()
                .map(SmartGroupMemberDto::getUserPrincipalName)
                .toList();
    }

    private SmartGroup getExistingSmartGroup(String groupId) {
        return smartGroupRepository.findById(groupId)
                .orElseThrow(() -> new ResourceNotFoundException("Smart group " + groupId + " not found"));
    }

    private static EnrichedUserInfo findUser(List<EnrichedUserInfo> users, String upn) {
        for (EnrichedUserInfo user : users) {
            if (user.getUserPrincipalName().equalsIgnoreCase(upn)) {
                return user;
            }
        }

        return null;
    }

    private static SmartGroupMemberDto mapMemberToDto(SmartGroupMember member) {
        return SmartGroupMemberDto.builder()
                .userPrincipalName(member.getUserPrincipalName())
                .displayName(member.getDisplayName())
                .department(member.getDepartment())
                .jobTitle(member.getJobTitle())
                .confidenceScore(member.getConfidenceScore())
                .build();
    }
}
