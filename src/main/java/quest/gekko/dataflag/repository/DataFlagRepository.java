package quest.gekko.dataflag.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import quest.gekko.dataflag.domain.DataFlag;

import java.util.List;

public interface DataFlagRepository extends JpaRepository<DataFlag, Long> {

    // Flags of a type that are active somewhere inside [start, finish]; open-ended flags never expire
    @Query("""
        select f from DataFlag f join f.type t
        where (:typeName is null or t.name = :typeName)
          and (:start is null or f.finishTime is null or f.finishTime >= :start)
          and (:finish is null or f.startTime <= :finish)
        order by f.startTime asc, f.id asc
        """)
    List<DataFlag> search(@Param("typeName") final String typeName,
                          @Param("start") final Double start,
                          @Param("finish") final Double finish);
}
