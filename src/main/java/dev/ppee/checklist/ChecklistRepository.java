package dev.ppee.checklist;

import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link Checklist} entities. */
public interface ChecklistRepository extends JpaRepository<Checklist, Long> {}
