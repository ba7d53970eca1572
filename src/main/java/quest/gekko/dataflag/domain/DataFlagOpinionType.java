package quest.gekko.dataflag.domain;

import jakarta.persistence.Entity;
import jakarta.persistence.Table;

/**
 * How opinions of this type are produced, e.g. manually or through a web front end.
 */
@Entity
@Table(name = "data_flag_opinion_type")
public class DataFlagOpinionType extends DataSubsetType {
}
