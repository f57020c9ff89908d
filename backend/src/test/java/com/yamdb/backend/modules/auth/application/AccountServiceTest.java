package com.yamdb.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.Optional;
import java.util.UUID;

import com.yamdb.backend.global.error.ErrorKind;
import com.yamdb.backend.global.error.ProblemException;
import com.yamdb.backend.modules.audit.application.AuditLogService;
import com.yamdb.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.yamdb.backend.modules.auth.domain.YamdbUser;
import com.yamdb.backend.modules.auth.infrastructure.persistence.YamdbUserRepository;
import com.yamdb.backend.modules.auth.presentation.dto.UserResponse;
import com.yamdb.backend.modules.policy.application.PolicyEnforcer;
import com.yamdb.backend.modules.policy.domain.Actor;
import com.yamdb.backend.modules.policy.domain.Role;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class AccountServiceTest {

    @Mock
    private YamdbUserRepository userRepository;

    @Mock
    private ConfirmationCodeService confirmationCodeService;

    @Mock
    private AuditLogService auditLogService;

    private AccountService accountService;
    private final Actor admin = new Actor(UUID.randomUUID(), "root", Role.ADMIN);

    @BeforeEach
    void setUp() {
        accountService = new AccountService(userRepository, confirmationCodeService, new PolicyEnforcer(), auditLogService);
    }

    @Test
    void moderatorCannotChangeRoles() {
        Actor moderator = new Actor(UUID.randomUUID(), "mod", Role.MODERATOR);

        assertThatThrownBy(() -> accountService.setRole(moderator, "alice", Role.ADMIN))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).getKind()).isEqualTo(ErrorKind.FORBIDDEN));
        verifyNoInteractions(userRepository, auditLogService);
    }

    @Test
    void anonymousIsNotAnAssignableRole() {
        assertThatThrownBy(() -> accountService.setRole(admin, "alice", Role.ANONYMOUS))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).getCode()).isEqualTo("auth.role_invalid"));
        verifyNoInteractions(userRepository);
    }

    @Test
    void unknownUserIsNotFound() {
        when(userRepository.findByUsername("ghost")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> accountService.setRole(admin, "ghost", Role.MODERATOR))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).getKind()).isEqualTo(ErrorKind.NOT_FOUND));
    }

    @Test
    void roleChangeIsAudited() {
        YamdbUser alice = user("alice", Role.USER);
        when(userRepository.findByUsername("alice")).thenReturn(Optional.of(alice));

        UserResponse response = accountService.setRole(admin, "alice", Role.MODERATOR);

        ArgumentCaptor<AuditLogCommand> command = ArgumentCaptor.forClass(AuditLogCommand.class);
        verify(auditLogService).record(command.capture());
        assertThat(response.role()).isEqualTo(Role.MODERATOR);
        assertThat(command.getValue().actionType()).isEqualTo("ROLE_CHANGE");
        assertThat(command.getValue().actorUserId()).isEqualTo(admin.userId());
        assertThat(command.getValue().detail()).containsEntry("from", "user").containsEntry("to", "moderator");
    }

    @Test
    void sameRoleIsNoOp() {
        YamdbUser alice = user("alice", Role.USER);
        when(userRepository.findByUsername("alice")).thenReturn(Optional.of(alice));

        accountService.setRole(admin, "alice", Role.USER);

        verify(userRepository, never()).save(any());
        verifyNoInteractions(auditLogService);
    }

    @Test
    void registerRejectsTakenEmailWithoutSaving() {
        when(userRepository.findByEmailIgnoreCase("taken@example.com")).thenReturn(Optional.of(user("holder", Role.USER)));

        assertThatThrownBy(() -> accountService.register("Taken@example.com", "newcomer"))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).getCode()).isEqualTo("auth.email_taken"));
        verify(userRepository, never()).saveAndFlush(any());
        verifyNoInteractions(confirmationCodeService);
    }

    @Test
    void registerRejectsReservedUsername() {
        assertThatThrownBy(() -> accountService.register("me@example.com", "me"))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).getKind()).isEqualTo(ErrorKind.VALIDATION));
        verifyNoInteractions(userRepository);
    }

    @Test
    void anonymousCannotLoadProfile() {
        assertThatThrownBy(() -> accountService.loadProfile(Actor.anonymous()))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).getKind()).isEqualTo(ErrorKind.FORBIDDEN));
    }

    private static YamdbUser user(String username, Role role) {
        YamdbUser user = new YamdbUser();
        ReflectionTestUtils.setField(user, "id", UUID.randomUUID());
        user.setUsername(username);
        user.setEmail(username + "@example.com");
        user.setRole(role);
        return user;
    }
}
