package quest.gekko.dataflag.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

/**
 * Audit record of one voting decision about one opinion. A vote without a flag means the
 * opinion was considered but did not result in a flag.
 */
@Entity
@Table(name = "data_flag_vote", indexes = @Index(name = "idx_vote_mode_time", columnList = "mode, vote_time"))
@Getter @Setter
public class DataFlagVote {
    public static final int MAX_MODE_LENGTH = 32;

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "vote_time", nullable = false)
    double time;

    @Column(nullable = false, length = MAX_MODE_LENGTH)
    String mode;

    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "client_id")
    DataFlagClient client;

    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "revision_id")
    DataRevision revision;

    @ManyToOne(fetch = FetchType.EAGER)
    @JoinColumn(name = "flag_id")
    DataFlag flag;

    @Column(nullable = false)
    int lsd;
}
