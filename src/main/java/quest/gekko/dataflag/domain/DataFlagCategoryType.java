package quest.gekko.dataflag.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

/**
 * Category a user can attach to an opinion about one day of data.
 */
@Entity
@Table(name = "data_flag_category_type")
@Getter @Setter
public class DataFlagCategoryType {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(nullable = false, unique = true, length = DataSubsetType.MAX_NAME_LENGTH)
    String name;

    @Column(columnDefinition = "text")
    String description;
}
