package quest.gekko.dataflag.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

/**
 * Software client used to create an opinion or cast a vote.
 */
@Entity
@Table(name = "data_flag_client", uniqueConstraints = @UniqueConstraint(columnNames = { "client_name", "client_version" }))
@Getter @Setter
public class DataFlagClient {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "client_name", nullable = false)
    String clientName;

    @Column(name = "client_version", nullable = false)
    String clientVersion;
}
