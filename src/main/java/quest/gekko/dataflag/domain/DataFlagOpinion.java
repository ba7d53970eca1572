package quest.gekko.dataflag.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import quest.gekko.dataflag.domain.converter.JsonMapConverter;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A person's opinion on whether the data of one LSD, as produced by one revision, is usable.
 * There is at most one opinion per (type, user, lsd, revision).
 */
@Entity
@Table(name = "data_flag_opinion",
        uniqueConstraints = @UniqueConstraint(columnNames = { "type_id", "user_id", "lsd", "revision_id" }))
@Getter @Setter
public class DataFlagOpinion {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "type_id")
    DataFlagOpinionType type;

    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "user_id")
    DataFlagUser user;

    @Column(nullable = false, length = 6)
    Decision decision;

    @Column(name = "creation_time", nullable = false)
    double creationTime;

    @Column(name = "last_edit", nullable = false)
    double lastEdit;

    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "client_id")
    DataFlagClient client;

    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "revision_id")
    DataRevision revision;

    @Column(nullable = false)
    int lsd;

    @Column(columnDefinition = "text")
    String notes;

    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "text")
    Map<String, Object> metadata;

    @ManyToMany(fetch = FetchType.EAGER)
    @JoinTable(name = "data_flag_opinion_category",
            joinColumns = @JoinColumn(name = "opinion_id"),
            inverseJoinColumns = @JoinColumn(name = "category_id"))
    Set<DataFlagCategoryType> categories = new LinkedHashSet<>();

    public String getInstrument() {
        return FlagMetadata.instrument(metadata);
    }

    public List<Integer> getFreq() {
        return FlagMetadata.freq(metadata);
    }

    public List<Integer> getInputs() {
        return FlagMetadata.inputs(metadata);
    }

    /** Advance the edit time; it never moves backwards. */
    public void touch(double now) {
        lastEdit = Math.max(Math.max(lastEdit, creationTime), now);
    }
}
