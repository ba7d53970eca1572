package quest.gekko.dataflag.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "data_flag_user")
@Getter @Setter
public class DataFlagUser {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "user_name", nullable = false, unique = true)
    String userName;

    @Column(nullable = false)
    Instant createdAt = Instant.now();

    /** Wiki convention: the first character of a user name is always upper case. */
    public static String normalize(String userName) {
        if (userName == null || userName.isBlank()) {
            return userName;
        }
        String trimmed = userName.trim();
        return Character.toUpperCase(trimmed.charAt(0)) + trimmed.substring(1);
    }
}
