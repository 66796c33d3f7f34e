package dev.vidcrawl.store;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link Comment} entities. */
public interface CommentRepository extends JpaRepository<Comment, Long> {

  List<Comment> findAllByVideoId(Long videoId);
}
