package me.golemcore.agentlink.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentlink.domain.model.AgentChannel;
import me.golemcore.agentlink.domain.model.ChannelClosedEvent;
import me.golemcore.agentlink.domain.model.ChannelConfig;
import me.golemcore.agentlink.domain.model.ChannelCreatedEvent;
import me.golemcore.agentlink.domain.model.ChannelMember;
import me.golemcore.agentlink.domain.model.ChannelRole;
import me.golemcore.agentlink.domain.model.ChannelUpdate;
import me.golemcore.agentlink.domain.model.ChannelUpdatedEvent;
import me.golemcore.agentlink.domain.model.MemberJoinedEvent;
import me.golemcore.agentlink.domain.model.MemberKickedEvent;
import me.golemcore.agentlink.domain.model.MemberLeftEvent;
import me.golemcore.agentlink.infrastructure.config.AgentLinkProperties;
import me.golemcore.agentlink.port.outbound.DomainEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Registry of channels, their members and the members' public keys.
 *
 * <p>
 * Reads run concurrently under a read lock, membership mutations are
 * serialized under the write lock. Channels and members handed out are
 * detached copies. Events are published after the lock is released.
 *
 * <p>
 * Refusals (unknown channel, missing role, owner removal) return {@code false}
 * and leave the registry unchanged.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class ChannelRegistry {

    private final DomainEventPublisher eventPublisher;
    private final AgentLinkProperties properties;
    private final Clock clock;

    private final Map<String, ChannelState> channels = new HashMap<>();
    private final Map<String, Set<String>> agentChannels = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public ChannelRegistry(DomainEventPublisher eventPublisher, AgentLinkProperties properties, Clock clock) {
        this.eventPublisher = eventPublisher;
        this.properties = properties;
        this.clock = clock;
    }

    // ==================== LIFECYCLE ====================

    public AgentChannel createChannel(String ownerId, Collection<String> participantIds, ChannelConfig config) {
        Instant now = clock.instant();
        ChannelConfig resolved = applyDefaults(config);
        String channelId = IdGenerator.channelId(ownerId, now);

        Set<String> participants = new LinkedHashSet<>();
        participants.add(ownerId);
        if (participantIds != null) {
            for (String participant : participantIds) {
                if (participant != null && !participant.isBlank()) {
                    participants.add(participant);
                }
            }
        }

        AgentChannel channel = AgentChannel.builder()
                .id(channelId)
                .name(resolved.getName() != null ? resolved.getName() : channelId)
                .participants(new ArrayList<>(participants))
                .ownerId(ownerId)
                .encryption(resolved.getEncryption())
                .messageSchema(resolved.getMessageSchema())
                .config(resolved)
                .open(Boolean.TRUE.equals(resolved.getOpen()))
                .createdAt(now)
                .build();

        ChannelState state = new ChannelState(channel);
        for (String participant : participants) {
            ChannelRole role = participant.equals(ownerId) ? ChannelRole.OWNER : ChannelRole.MEMBER;
            state.members.put(participant, ChannelMember.builder()
                    .agentId(participant)
                    .joinedAt(now)
                    .role(role)
                    .build());
        }

        AgentChannel snapshot = write(() -> {
            channels.put(channelId, state);
            participants.forEach(agentId -> index(agentId, channelId));
            return channel.copy();
        });

        log.info("[Channels] Created {} (owner={}, members={}, encryption={})", channelId, ownerId,
                participants.size(), resolved.getEncryption());
        eventPublisher.publish(new ChannelCreatedEvent(channelId, snapshot));
        return snapshot;
    }

    public boolean closeChannel(String channelId, String requesterId) {
        boolean closed = write(() -> {
            ChannelState state = channels.get(channelId);
            if (state == null || !state.channel.getOwnerId().equals(requesterId)) {
                return false;
            }
            channels.remove(channelId);
            state.members.keySet().forEach(agentId -> unindex(agentId, channelId));
            return true;
        });
        if (closed) {
            log.info("[Channels] Closed {} by {}", channelId, requesterId);
            eventPublisher.publish(new ChannelClosedEvent(channelId, requesterId));
        }
        return closed;
    }

    public boolean updateChannel(String channelId, String requesterId, ChannelUpdate update) {
        AgentChannel updated = write(() -> {
            ChannelState state = channels.get(channelId);
            if (state == null || update == null || !state.channel.getOwnerId().equals(requesterId)) {
                return null;
            }
            AgentChannel channel = state.channel;
            if (update.name() != null) {
                channel.setName(update.name());
                channel.getConfig().setName(update.name());
            }
            if (update.open() != null) {
                channel.setOpen(update.open());
            }
            if (update.messageSchema() != null) {
                channel.setMessageSchema(update.messageSchema());
                channel.getConfig().setMessageSchema(update.messageSchema());
            }
            return channel.copy();
        });
        if (updated == null) {
            return false;
        }
        eventPublisher.publish(new ChannelUpdatedEvent(channelId, updated));
        return true;
    }

    // ==================== MEMBERSHIP ====================

    /**
     * Join a channel, storing {@code publicKey} when given. Members re-joining
     * only refresh their key.
     */
    public boolean joinChannel(String channelId, String agentId, String publicKey) {
        JoinOutcome outcome = write(() -> {
            ChannelState state = channels.get(channelId);
            if (state == null) {
                return JoinOutcome.REFUSED;
            }
            ChannelMember existing = state.members.get(agentId);
            if (existing != null) {
                if (publicKey != null) {
                    existing.setPublicKey(publicKey);
                    state.keys.put(agentId, publicKey);
                }
                return JoinOutcome.ALREADY_MEMBER;
            }
            if (!state.channel.isOpen() && !state.channel.hasParticipant(agentId)) {
                return JoinOutcome.REFUSED;
            }
            state.members.put(agentId, ChannelMember.builder()
                    .agentId(agentId)
                    .joinedAt(clock.instant())
                    .role(ChannelRole.MEMBER)
                    .publicKey(publicKey)
                    .build());
            if (publicKey != null) {
                state.keys.put(agentId, publicKey);
            }
            if (!state.channel.hasParticipant(agentId)) {
                state.channel.getParticipants().add(agentId);
            }
            index(agentId, channelId);
            return JoinOutcome.JOINED;
        });
        if (outcome == JoinOutcome.JOINED) {
            log.debug("[Channels] {} joined {}", agentId, channelId);
            eventPublisher.publish(new MemberJoinedEvent(channelId, agentId));
        }
        return outcome != JoinOutcome.REFUSED;
    }

    public boolean leaveChannel(String channelId, String agentId) {
        boolean left = write(() -> {
            ChannelState state = channels.get(channelId);
            if (state == null || !state.members.containsKey(agentId)
                    || state.channel.getOwnerId().equals(agentId)) {
                return false;
            }
            removeMember(state, agentId);
            return true;
        });
        if (left) {
            log.debug("[Channels] {} left {}", agentId, channelId);
            eventPublisher.publish(new MemberLeftEvent(channelId, agentId));
        }
        return left;
    }

    public boolean kickMember(String channelId, String requesterId, String targetId, String reason) {
        boolean kicked = write(() -> {
            ChannelState state = channels.get(channelId);
            if (state == null) {
                return false;
            }
            ChannelMember requester = state.members.get(requesterId);
            if (requester == null || !requester.getRole().canModerate()) {
                return false;
            }
            if (!state.members.containsKey(targetId) || state.channel.getOwnerId().equals(targetId)) {
                return false;
            }
            removeMember(state, targetId);
            return true;
        });
        if (kicked) {
            log.info("[Channels] {} kicked {} from {}: {}", requesterId, targetId, channelId, reason);
            eventPublisher.publish(new MemberKickedEvent(channelId, targetId, requesterId, reason));
        }
        return kicked;
    }

    public boolean promoteToAdmin(String channelId, String requesterId, String targetId) {
        return changeRole(channelId, requesterId, targetId, ChannelRole.ADMIN);
    }

    public boolean demoteToMember(String channelId, String requesterId, String targetId) {
        return changeRole(channelId, requesterId, targetId, ChannelRole.MEMBER);
    }

    private boolean changeRole(String channelId, String requesterId, String targetId, ChannelRole role) {
        return write(() -> {
            ChannelState state = channels.get(channelId);
            if (state == null || !state.channel.getOwnerId().equals(requesterId)) {
                return false;
            }
            ChannelMember target = state.members.get(targetId);
            if (target == null || target.getRole() == ChannelRole.OWNER) {
                return false;
            }
            target.setRole(role);
            return true;
        });
    }

    private void removeMember(ChannelState state, String agentId) {
        String channelId = state.channel.getId();
        state.members.remove(agentId);
        state.keys.remove(agentId);
        state.channel.getParticipants().remove(agentId);
        unindex(agentId, channelId);
    }

    // ==================== PUBLIC KEYS ====================

    public boolean setPublicKey(String channelId, String agentId, String publicKey) {
        return write(() -> {
            ChannelState state = channels.get(channelId);
            if (state == null || !state.members.containsKey(agentId) || publicKey == null) {
                return false;
            }
            state.keys.put(agentId, publicKey);
            state.members.get(agentId).setPublicKey(publicKey);
            return true;
        });
    }

    public String getPublicKey(String channelId, String agentId) {
        return read(() -> {
            ChannelState state = channels.get(channelId);
            return state != null ? state.keys.get(agentId) : null;
        });
    }

    public Map<String, String> getAllPublicKeys(String channelId) {
        return read(() -> {
            ChannelState state = channels.get(channelId);
            return state != null ? new LinkedHashMap<>(state.keys) : Map.of();
        });
    }

    // ==================== QUERIES ====================

    public Optional<AgentChannel> getChannel(String channelId) {
        return read(() -> {
            ChannelState state = channels.get(channelId);
            return Optional.ofNullable(state).map(s -> s.channel.copy());
        });
    }

    public List<AgentChannel> getAllChannels() {
        return read(() -> channels.values().stream().map(s -> s.channel.copy()).toList());
    }

    public List<AgentChannel> getAgentChannels(String agentId) {
        return read(() -> agentChannels.getOrDefault(agentId, Set.of()).stream()
                .map(channels::get)
                .filter(Objects::nonNull)
                .map(s -> s.channel.copy())
                .toList());
    }

    public List<ChannelMember> getMembers(String channelId) {
        return read(() -> {
            ChannelState state = channels.get(channelId);
            if (state == null) {
                return List.of();
            }
            return state.members.values().stream().map(m -> m.toBuilder().build()).toList();
        });
    }

    public Optional<ChannelMember> getMember(String channelId, String agentId) {
        return read(() -> {
            ChannelState state = channels.get(channelId);
            if (state == null) {
                return Optional.empty();
            }
            return Optional.ofNullable(state.members.get(agentId)).map(m -> m.toBuilder().build());
        });
    }

    public boolean isMember(String channelId, String agentId) {
        return read(() -> {
            ChannelState state = channels.get(channelId);
            return state != null && state.members.containsKey(agentId);
        });
    }

    // ==================== INTERNALS ====================

    private ChannelConfig applyDefaults(ChannelConfig config) {
        AgentLinkProperties.ChannelDefaultsProperties defaults = properties.getChannels();
        ChannelConfig source = config != null ? config : new ChannelConfig();
        return ChannelConfig.builder()
                .name(source.getName())
                .encryption(source.getEncryption() != null ? source.getEncryption() : defaults.getEncryption())
                .messageSchema(source.getMessageSchema())
                .maxMessageSize(source.getMaxMessageSize() != null ? source.getMaxMessageSize()
                        : defaults.getMaxMessageSize())
                .messageTtl(source.getMessageTtl() != null ? source.getMessageTtl() : defaults.getMessageTtl())
                .requireAck(source.getRequireAck() != null ? source.getRequireAck() : defaults.isRequireAck())
                .retryCount(source.getRetryCount() != null ? source.getRetryCount() : defaults.getRetryCount())
                .open(source.getOpen() != null ? source.getOpen() : Boolean.FALSE)
                .build();
    }

    private void index(String agentId, String channelId) {
        agentChannels.computeIfAbsent(agentId, k -> new LinkedHashSet<>()).add(channelId);
    }

    private void unindex(String agentId, String channelId) {
        Set<String> ids = agentChannels.get(agentId);
        if (ids != null) {
            ids.remove(channelId);
            if (ids.isEmpty()) {
                agentChannels.remove(agentId);
            }
        }
    }

    private <T> T read(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private <T> T write(Supplier<T> action) {
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private enum JoinOutcome {
        JOINED, ALREADY_MEMBER, REFUSED
    }

    private static final class ChannelState {
        private final AgentChannel channel;
        private final Map<String, ChannelMember> members = new LinkedHashMap<>();
        private final Map<String, String> keys = new LinkedHashMap<>();

        private ChannelState(AgentChannel channel) {
            this.channel = channel;
        }
    }
}
