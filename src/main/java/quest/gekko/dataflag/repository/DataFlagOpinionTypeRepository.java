package quest.gekko.dataflag.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.dataflag.domain.DataFlagOpinionType;

import java.util.List;
import java.util.Optional;

public interface DataFlagOpinionTypeRepository extends JpaRepository<DataFlagOpinionType, Long> {
    Optional<DataFlagOpinionType> findByName(final String name);
    List<DataFlagOpinionType> findAllByOrderByIdAsc();
}
