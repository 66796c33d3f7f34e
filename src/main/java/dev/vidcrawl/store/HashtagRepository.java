package dev.vidcrawl.store;

import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link Hashtag} entities. */
public interface HashtagRepository extends JpaRepository<Hashtag, Long> {

  List<Hashtag> findAllByNameIn(Collection<String> names);
}
