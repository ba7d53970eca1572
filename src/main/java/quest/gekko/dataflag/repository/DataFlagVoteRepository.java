package quest.gekko.dataflag.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import quest.gekko.dataflag.domain.DataFlag;
import quest.gekko.dataflag.domain.DataFlagVote;
import quest.gekko.dataflag.domain.DataRevision;

import java.util.List;

public interface DataFlagVoteRepository extends JpaRepository<DataFlagVote, Long> {

    @Query("select max(v.time) from DataFlagVote v where v.mode = :mode")
    Double findLastVoteTime(@Param("mode") final String mode);

    @Query("""
        select v.flag from DataFlagVote v
        where v.mode = :mode and v.revision = :revision and v.lsd = :lsd and v.flag is not null
        order by v.time desc, v.id desc
        """)
    List<DataFlag> findVotedFlags(@Param("mode") final String mode,
                                  @Param("revision") final DataRevision revision,
                                  @Param("lsd") final int lsd);

    List<DataFlagVote> findByRevisionOrderByTimeAscIdAsc(final DataRevision revision);
    List<DataFlagVote> findByRevisionAndModeOrderByTimeAscIdAsc(final DataRevision revision, final String mode);
}
