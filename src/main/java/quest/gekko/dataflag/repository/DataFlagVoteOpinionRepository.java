package quest.gekko.dataflag.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import quest.gekko.dataflag.domain.DataFlagVoteOpinion;
import quest.gekko.dataflag.domain.VoteOpinionId;

import java.util.Collection;
import java.util.List;

public interface DataFlagVoteOpinionRepository extends JpaRepository<DataFlagVoteOpinion, VoteOpinionId> {

    @Query("select vo from DataFlagVoteOpinion vo where vo.id.voteId in :voteIds")
    List<DataFlagVoteOpinion> findByVoteIds(@Param("voteIds") final Collection<Long> voteIds);
}
