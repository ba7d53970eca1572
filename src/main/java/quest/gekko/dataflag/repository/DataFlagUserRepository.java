package quest.gekko.dataflag.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.dataflag.domain.DataFlagUser;

import java.util.List;
import java.util.Optional;

public interface DataFlagUserRepository extends JpaRepository<DataFlagUser, Long> {
    Optional<DataFlagUser> findByUserName(final String userName);
    List<DataFlagUser> findAllByOrderByUserNameAsc();
}
