package dev.ppee.checklist;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link ChecklistParameter} entities. */
public interface ChecklistParameterRepository extends JpaRepository<ChecklistParameter, Long> {

  /**
   * Returns the parameters of a checklist in display order.
   *
   * @param checklistId the checklist
   * @return parameters ordered by {@code order_index}, then id
   */
  List<ChecklistParameter> findByChecklistIdOrderByOrderIndexAscIdAsc(Long checklistId);
}
