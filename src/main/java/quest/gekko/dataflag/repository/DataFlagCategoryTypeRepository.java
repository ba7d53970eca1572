package quest.gekko.dataflag.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.dataflag.domain.DataFlagCategoryType;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface DataFlagCategoryTypeRepository extends JpaRepository<DataFlagCategoryType, Long> {
    Optional<DataFlagCategoryType> findByName(final String name);
    List<DataFlagCategoryType> findByNameIn(final Collection<String> names);
    List<DataFlagCategoryType> findAllByOrderByIdAsc();
}
