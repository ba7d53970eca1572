package quest.gekko.dataflag.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.dataflag.domain.DataRevision;

import java.util.List;
import java.util.Optional;

public interface DataRevisionRepository extends JpaRepository<DataRevision, Long> {
    Optional<DataRevision> findByName(final String name);
    List<DataRevision> findAllByOrderByIdAsc();
}
