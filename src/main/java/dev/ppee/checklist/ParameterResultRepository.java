package dev.ppee.checklist;

import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link ParameterResult} entities. */
public interface ParameterResultRepository extends JpaRepository<ParameterResult, Long> {

  Optional<ParameterResult> findByApplicationIdAndParameterId(
      String applicationId, Long parameterId);

  List<ParameterResult> findByApplicationId(String applicationId);
}
