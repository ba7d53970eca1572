package quest.gekko.dataflag.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import quest.gekko.dataflag.domain.converter.JsonMapConverter;

import java.util.List;
import java.util.Map;

/**
 * A flagged range of data, given as UNIX start and (optional) finish times.
 * <p>
 * The metadata map follows the schema in {@link FlagMetadata}: a flag without {@code freq}
 * applies to all frequencies, one without {@code inputs} to all inputs of its instrument, and
 * one without {@code instrument} to every instrument.
 */
@Entity
@Table(name = "data_flag")
@Getter @Setter
public class DataFlag {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "type_id")
    DataFlagType type;

    @Column(name = "start_time", nullable = false)
    double startTime;

    @Column(name = "finish_time")
    Double finishTime;

    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "text")
    Map<String, Object> metadata;

    public String getInstrument() {
        return FlagMetadata.instrument(metadata);
    }

    public List<Integer> getFreq() {
        return FlagMetadata.freq(metadata);
    }

    public List<Integer> getInputs() {
        return FlagMetadata.inputs(metadata);
    }

    public boolean[] freqMask() {
        return FlagMetadata.freqMask(metadata);
    }

    public boolean[] inputMask() {
        return FlagMetadata.inputMask(metadata);
    }
}
