package quest.gekko.dataflag.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.dataflag.domain.DataFlagClient;

import java.util.Optional;

public interface DataFlagClientRepository extends JpaRepository<DataFlagClient, Long> {
    Optional<DataFlagClient> findByClientNameAndClientVersion(final String clientName, final String clientVersion);
}
