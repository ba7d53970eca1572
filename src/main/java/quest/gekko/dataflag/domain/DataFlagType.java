package quest.gekko.dataflag.domain;

import jakarta.persistence.Entity;
import jakarta.persistence.Table;

@Entity
@Table(name = "data_flag_type")
public class DataFlagType extends DataSubsetType {
}
