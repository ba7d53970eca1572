package quest.gekko.dataflag.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;

import java.io.Serializable;

@Embeddable
@Getter
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode
public class VoteOpinionId implements Serializable {
    @Column(name = "vote_id")
    Long voteId;

    @Column(name = "opinion_id")
    Long opinionId;
}
