package com.fitlog.backend.users.user.entity;

import com.fitlog.backend.common.entity.AuditedEntity;
import jakarta.persistence.*;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@Getter @Setter @NoArgsConstructor
@ToString(exclude = "passwordHash")
@Entity
@Table(
        name = "users",
        uniqueConstraints = {
                @UniqueConstraint(name = "ux_users_username", columnNames = {"username"}),
                @UniqueConstraint(name = "ux_users_email", columnNames = {"email"})
        }
)
public class User extends AuditedEntity {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotBlank
    @Size(max = 64)
    @Column(name = "username", nullable = false, length = 64)
    private String username;

    @NotBlank
    @Email
    @Size(max = 320)
    @Column(name = "email", nullable = false, length = 320)
    private String email;

    @NotBlank
    @Column(name = "password_hash", nullable = false)
    private String passwordHash;

    @Column(name = "first_name", length = 100)
    private String firstName;

    @Column(name = "last_name", length = 100)
    private String lastName;

    public User(String username, String email, String passwordHash) {
        setUsername(username);
        setEmail(email);
        this.passwordHash = passwordHash;
    }

    /** Stored lower-case so uniqueness does not depend on letter case. */
    public void setEmail(String email) {
        this.email = (email == null) ? null : email.trim().toLowerCase();
    }

    public void setUsername(String username) {
        this.username = (username == null) ? null : username.trim();
    }
}
