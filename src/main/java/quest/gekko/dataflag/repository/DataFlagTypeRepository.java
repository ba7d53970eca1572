package quest.gekko.dataflag.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.dataflag.domain.DataFlagType;

import java.util.List;
import java.util.Optional;

public interface DataFlagTypeRepository extends JpaRepository<DataFlagType, Long> {
    Optional<DataFlagType> findByName(final String name);
    List<DataFlagType> findAllByOrderByIdAsc();
}
