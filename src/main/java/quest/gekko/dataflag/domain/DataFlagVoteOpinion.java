package quest.gekko.dataflag.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

/**
 * Links a vote to the opinions it is a record for. Created together with its vote and never
 * changed afterwards.
 */
@Entity
@Table(name = "data_flag_vote_opinion")
@Getter
@NoArgsConstructor
public class DataFlagVoteOpinion implements Persistable<VoteOpinionId> {
    @EmbeddedId
    VoteOpinionId id;

    @MapsId("voteId")
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "vote_id")
    DataFlagVote vote;

    @MapsId("opinionId")
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "opinion_id")
    DataFlagOpinion opinion;

    @Transient
    boolean created = true;

    public DataFlagVoteOpinion(DataFlagVote vote, DataFlagOpinion opinion) {
        this.id = new VoteOpinionId(vote.getId(), opinion.getId());
        this.vote = vote;
        this.opinion = opinion;
    }

    @Override
    public boolean isNew() {
        return created;
    }

    @PostLoad
    @PostPersist
    void markStored() {
        created = false;
    }
}
