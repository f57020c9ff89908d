package com.yamdb.backend.modules.auth.application;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.yamdb.backend.global.error.ErrorKind;
import com.yamdb.backend.global.error.ProblemException;
import com.yamdb.backend.global.web.PageResponse;
import com.yamdb.backend.modules.audit.application.AuditLogService;
import com.yamdb.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.yamdb.backend.modules.auth.domain.AccountRules;
import com.yamdb.backend.modules.auth.domain.YamdbUser;
import com.yamdb.backend.modules.auth.infrastructure.persistence.YamdbUserRepository;
import com.yamdb.backend.modules.auth.presentation.dto.CreateUserRequest;
import com.yamdb.backend.modules.auth.presentation.dto.UpdateProfileRequest;
import com.yamdb.backend.modules.auth.presentation.dto.UpdateUserRequest;
import com.yamdb.backend.modules.auth.presentation.dto.UserDtoMapper;
import com.yamdb.backend.modules.auth.presentation.dto.UserResponse;
import com.yamdb.backend.modules.policy.application.PolicyEnforcer;
import com.yamdb.backend.modules.policy.domain.Actor;
import com.yamdb.backend.modules.policy.domain.PolicyAction;
import com.yamdb.backend.modules.policy.domain.Role;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Identity and role store: registration, role changes, admin user management and own-profile edits.
 */
@Service
@Transactional
public class AccountService {

    private static final Logger log = LoggerFactory.getLogger(AccountService.class);
    private static final String RESOURCE_TYPE = "USER";

    private final YamdbUserRepository userRepository;
    private final ConfirmationCodeService confirmationCodeService;
    private final PolicyEnforcer policyEnforcer;
    private final AuditLogService auditLogService;

    public AccountService(
            YamdbUserRepository userRepository,
            ConfirmationCodeService confirmationCodeService,
            PolicyEnforcer policyEnforcer,
            AuditLogService auditLogService
    ) {
        this.userRepository = userRepository;
        this.confirmationCodeService = confirmationCodeService;
        this.policyEnforcer = policyEnforcer;
        this.auditLogService = auditLogService;
    }

    /**
     * Creates a USER account and issues its first confirmation code.
     */
    public YamdbUser register(String email, String username) {
        String normalizedEmail = AccountRules.requireValidEmail(email);
        String normalizedUsername = AccountRules.requireValidUsername(username);
        ensureEmailAvailable(normalizedEmail, null);
        ensureUsernameAvailable(normalizedUsername, null);

        YamdbUser user = new YamdbUser();
        user.setEmail(normalizedEmail);
        user.setUsername(normalizedUsername);
        user.setRole(Role.USER);
        YamdbUser saved = saveUnique(user);
        confirmationCodeService.issueCode(saved);
        log.info("Registered user {}", saved.getUsername());
        return saved;
    }

    @Transactional(readOnly = true)
    public Optional<YamdbUser> lookup(String username) {
        if (!StringUtils.hasText(username)) {
            return Optional.empty();
        }
        return userRepository.findByUsername(username.trim());
    }

    public UserResponse setRole(Actor actor, String username, Role newRole) {
        policyEnforcer.require(actor, PolicyAction.CHANGE_ROLE);
        if (newRole == null || !newRole.isAssignable()) {
            throw new ProblemException(ErrorKind.VALIDATION, "auth.role_invalid", "Role must be user, moderator or admin");
        }
        YamdbUser user = requireUser(username);
        Role previous = user.getRole();
        if (previous != newRole) {
            user.setRole(newRole);
            userRepository.save(user);
            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("from", previous.code());
            detail.put("to", newRole.code());
            auditLogService.record(new AuditLogCommand("ROLE_CHANGE", RESOURCE_TYPE, user.getId().toString(), actor.userId(), detail));
            log.info("User {} changed role of {} from {} to {}", actor.username(), user.getUsername(), previous, newRole);
        }
        return UserDtoMapper.toResponse(user);
    }

    @Transactional(readOnly = true)
    public PageResponse<UserResponse> listUsers(Actor actor, String search, Pageable pageable) {
        policyEnforcer.require(actor, PolicyAction.MANAGE_USERS);
        String prefix = StringUtils.hasText(search) ? search.trim() : "";
        Page<YamdbUser> page = userRepository.findByUsernameStartingWithIgnoreCase(prefix, pageable);
        return PageResponse.of(page, UserDtoMapper::toResponse);
    }

    /**
     * Admin-created accounts get no confirmation code until the user signs up with the same pair.
     */
    public UserResponse createUser(Actor actor, CreateUserRequest request) {
        policyEnforcer.require(actor, PolicyAction.MANAGE_USERS);
        String email = AccountRules.requireValidEmail(request.email());
        String username = AccountRules.requireValidUsername(request.username());
        Role role = request.role() != null ? request.role() : Role.USER;
        if (!role.isAssignable()) {
            throw new ProblemException(ErrorKind.VALIDATION, "auth.role_invalid", "Role must be user, moderator or admin");
        }
        ensureEmailAvailable(email, null);
        ensureUsernameAvailable(username, null);

        YamdbUser user = new YamdbUser();
        user.setEmail(email);
        user.setUsername(username);
        user.setRole(role);
        user.setFirstName(AccountRules.optionalName("first_name", request.firstName()));
        user.setLastName(AccountRules.optionalName("last_name", request.lastName()));
        user.setBio(request.bio());
        YamdbUser saved = saveUnique(user);
        log.info("User {} created account {} with role {}", actor.username(), saved.getUsername(), role);
        return UserDtoMapper.toResponse(saved);
    }

    @Transactional(readOnly = true)
    public UserResponse getUser(Actor actor, String username) {
        policyEnforcer.require(actor, PolicyAction.MANAGE_USERS);
        return UserDtoMapper.toResponse(requireUser(username));
    }

    public UserResponse updateUser(Actor actor, String username, UpdateUserRequest request) {
        policyEnforcer.require(actor, PolicyAction.MANAGE_USERS);
        YamdbUser user = requireUser(username);
        applyProfileChanges(user, request.username(), request.email(), request.firstName(), request.lastName(), request.bio());
        saveUnique(user);
        if (request.role() != null) {
            return setRole(actor, user.getUsername(), request.role());
        }
        return UserDtoMapper.toResponse(user);
    }

    /**
     * Reviews and comments of the deleted user keep existing with no author.
     */
    public void deleteUser(Actor actor, String username) {
        policyEnforcer.require(actor, PolicyAction.MANAGE_USERS);
        YamdbUser user = requireUser(username);
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("username", user.getUsername());
        detail.put("role", user.getRole().code());
        auditLogService.record(new AuditLogCommand("USER_DELETE", RESOURCE_TYPE, user.getId().toString(), actor.userId(), detail));
        userRepository.delete(user);
        userRepository.flush();
        log.info("User {} deleted account {}", actor.username(), username);
    }

    @Transactional(readOnly = true)
    public UserResponse loadProfile(Actor actor) {
        policyEnforcer.require(actor, PolicyAction.MANAGE_OWN_PROFILE, true);
        return UserDtoMapper.toResponse(requireSelf(actor));
    }

    public UserResponse updateProfile(Actor actor, UpdateProfileRequest request) {
        policyEnforcer.require(actor, PolicyAction.MANAGE_OWN_PROFILE, true);
        YamdbUser user = requireSelf(actor);
        applyProfileChanges(user, request.username(), request.email(), request.firstName(), request.lastName(), request.bio());
        return UserDtoMapper.toResponse(saveUnique(user));
    }

    private void applyProfileChanges(YamdbUser user, String username, String email, String firstName, String lastName, String bio) {
        if (username != null) {
            String normalized = AccountRules.requireValidUsername(username);
            ensureUsernameAvailable(normalized, user);
            user.setUsername(normalized);
        }
        if (email != null) {
            String normalized = AccountRules.requireValidEmail(email);
            ensureEmailAvailable(normalized, user);
            user.setEmail(normalized);
        }
        if (firstName != null) {
            user.setFirstName(AccountRules.optionalName("first_name", firstName));
        }
        if (lastName != null) {
            user.setLastName(AccountRules.optionalName("last_name", lastName));
        }
        if (bio != null) {
            user.setBio(bio);
        }
    }

    private YamdbUser requireUser(String username) {
        return lookup(username)
                .orElseThrow(() -> new ProblemException(ErrorKind.NOT_FOUND, "auth.user_not_found", "User not found"));
    }

    private YamdbUser requireSelf(Actor actor) {
        return userRepository.findById(actor.userId())
                .orElseThrow(() -> new ProblemException(ErrorKind.UNAUTHENTICATED, "auth.account_missing",
                        "The account behind this token no longer exists"));
    }

    private void ensureUsernameAvailable(String username, YamdbUser self) {
        userRepository.findByUsername(username)
                .filter(existing -> self == null || !existing.getId().equals(self.getId()))
                .ifPresent(existing -> {
                    throw new ProblemException(ErrorKind.VALIDATION, "auth.username_taken", "Username is already taken");
                });
    }

    private void ensureEmailAvailable(String email, YamdbUser self) {
        userRepository.findByEmailIgnoreCase(email)
                .filter(existing -> self == null || !existing.getId().equals(self.getId()))
                .ifPresent(existing -> {
                    throw new ProblemException(ErrorKind.VALIDATION, "auth.email_taken", "Email is already registered");
                });
    }

    private YamdbUser saveUnique(YamdbUser user) {
        try {
            return userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            throw translateUniqueViolation(ex);
        }
    }

    private RuntimeException translateUniqueViolation(DataIntegrityViolationException ex) {
        Throwable cause = NestedExceptionUtils.getMostSpecificCause(ex);
        String message = cause.getMessage() != null ? cause.getMessage() : "";
        if (message.contains("uq_app_user_username")) {
            return new ProblemException(ErrorKind.VALIDATION, "auth.username_taken", "Username is already taken");
        }
        if (message.contains("uq_app_user_email_lower")) {
            return new ProblemException(ErrorKind.VALIDATION, "auth.email_taken", "Email is already registered");
        }
        return ex;
    }
}
