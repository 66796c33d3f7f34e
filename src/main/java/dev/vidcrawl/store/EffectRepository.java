package dev.vidcrawl.store;

import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link Effect} entities. */
public interface EffectRepository extends JpaRepository<Effect, Long> {

  List<Effect> findAllByEffectIdIn(Collection<String> effectIds);
}
