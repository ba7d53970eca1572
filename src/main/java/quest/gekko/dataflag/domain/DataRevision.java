package quest.gekko.dataflag.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

/**
 * Revision of the offline pipeline that produced the data opinions and votes are based on.
 */
@Entity
@Table(name = "data_revision")
@Getter @Setter
public class DataRevision {
    public static final int MAX_NAME_LENGTH = 32;

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(nullable = false, unique = true, length = MAX_NAME_LENGTH)
    String name;

    @Column(columnDefinition = "text")
    String description;
}
