package quest.gekko.dataflag.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import quest.gekko.dataflag.domain.converter.JsonMapConverter;

import java.util.Map;

/**
 * Common columns of catalog entries describing why a subset of data is flagged or judged.
 */
@MappedSuperclass
@Getter @Setter
public abstract class DataSubsetType {
    public static final int MAX_NAME_LENGTH = 64;

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(nullable = false, unique = true, length = MAX_NAME_LENGTH)
    String name;

    @Column(columnDefinition = "text")
    String description;

    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "text")
    Map<String, Object> metadata;
}
