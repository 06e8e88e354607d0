package com.fitlog.backend.users.user.service;

import com.fitlog.backend.common.error.ConstraintViolationException;
import com.fitlog.backend.common.error.DependencyConflictException;
import com.fitlog.backend.common.error.NotFoundException;
import com.fitlog.backend.common.validation.EntityValidator;
import com.fitlog.backend.users.user.entity.User;
import com.fitlog.backend.users.user.repo.UserRepo;
import com.fitlog.backend.workout.repo.WorkoutSessionRepo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
public class UserService {

    private final UserRepo users;
    private final WorkoutSessionRepo sessions;
    private final EntityValidator validator;

    public UserService(UserRepo users, WorkoutSessionRepo sessions, EntityValidator validator) {
        this.users = users;
        this.sessions = sessions;
        this.validator = validator;
    }

    @Transactional
    public User create(User user) {
        user.setId(null);
        validator.validate(user);
        checkUnique(user, null);

        User saved = EntityValidator.translate("user", () -> users.saveAndFlush(user));
        log.info("user created id={} username={}", saved.getId(), saved.getUsername());
        return saved;
    }

    @Transactional(readOnly = true)
    public User get(Long id) {
        if (id == null) throw new NotFoundException("user", null);
        return users.findById(id).orElseThrow(() -> new NotFoundException("user", id));
    }

    @Transactional(readOnly = true)
    public Optional<User> findByUsername(String username) {
        return users.findByUsername(username == null ? null : username.trim());
    }

    @Transactional
    public User update(User changes) {
        User row = get(changes.getId());

        row.setUsername(changes.getUsername());
        row.setEmail(changes.getEmail());
        row.setPasswordHash(changes.getPasswordHash());
        row.setFirstName(changes.getFirstName());
        row.setLastName(changes.getLastName());

        validator.validate(row);
        checkUnique(row, row.getId());
        row.markEdited();
        return EntityValidator.translate("user", () -> users.saveAndFlush(row));
    }

    /** Restricted while the user still owns workout sessions. */
    @Transactional
    public void delete(Long id) {
        User row = get(id);
        long owned = sessions.countByUserId(id);
        if (owned > 0) {
            throw new DependencyConflictException("user", id, "workout_session", owned);
        }
        EntityValidator.translateDelete("user", id, "workout_session", () -> {
            users.delete(row);
            users.flush();
        });
        log.info("user deleted id={}", id);
    }

    private void checkUnique(User u, Long selfId) {
        Map<String, String> clash = new LinkedHashMap<>();
        boolean usernameTaken = (selfId == null)
                ? users.existsByUsername(u.getUsername())
                : users.existsByUsernameAndIdNot(u.getUsername(), selfId);
        boolean emailTaken = (selfId == null)
                ? users.existsByEmailIgnoreCase(u.getEmail())
                : users.existsByEmailIgnoreCaseAndIdNot(u.getEmail(), selfId);
        if (usernameTaken) clash.put("username", "USERNAME_TAKEN");
        if (emailTaken) clash.put("email", "EMAIL_TAKEN");
        if (!clash.isEmpty()) throw new ConstraintViolationException(clash);
    }
}
