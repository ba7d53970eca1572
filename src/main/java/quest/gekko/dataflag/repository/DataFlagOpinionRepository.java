package quest.gekko.dataflag.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import quest.gekko.dataflag.domain.*;

import java.util.List;
import java.util.Optional;

public interface DataFlagOpinionRepository extends JpaRepository<DataFlagOpinion, Long> {
    Optional<DataFlagOpinion> findByTypeAndUserAndLsdAndRevision(final DataFlagOpinionType type, final DataFlagUser user,
                                                                 final int lsd, final DataRevision revision);

    @Query("""
        select o from DataFlagOpinion o
        where (:revision is null or o.revision.name = :revision)
          and (:userName is null or o.user.userName = :userName)
          and (:typeName is null or o.type.name = :typeName)
          and (:lsd is null or o.lsd = :lsd)
        order by o.lsd asc, o.id asc
        """)
    List<DataFlagOpinion> search(@Param("revision") final String revision,
                                 @Param("userName") final String userName,
                                 @Param("typeName") final String typeName,
                                 @Param("lsd") final Integer lsd);

    // Opinions edited since the low-water mark that no vote of this mode has seen in their current state
    @Query("""
        select o from DataFlagOpinion o
        where o.revision = :revision
          and o.lastEdit >= :minLastEdit
          and not exists (
              select vo from DataFlagVoteOpinion vo
              where vo.opinion = o and vo.vote.mode = :mode and vo.vote.time >= o.lastEdit)
        order by o.lsd asc, o.id asc
        """)
    List<DataFlagOpinion> findUnconsidered(@Param("revision") final DataRevision revision,
                                           @Param("minLastEdit") final double minLastEdit,
                                           @Param("mode") final String mode);

    @Query("""
        select count(o) from DataFlagOpinion o
        where o.revision = :revision and o.lsd = :lsd and o.decision <> :decision
        """)
    long countConflicting(@Param("lsd") final int lsd,
                          @Param("revision") final DataRevision revision,
                          @Param("decision") final Decision decision);
}
