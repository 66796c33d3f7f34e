package dev.vidcrawl.store;

import java.util.List;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Merges comments by comment id; a stored comment is replaced wholesale. */
@Service
public class CommentUpsertService {

  private final CommentRepository commentRepository;

  public CommentUpsertService(CommentRepository commentRepository) {
    this.commentRepository = commentRepository;
  }

  @Transactional
  public void upsert(List<CommentRecord> comments) {
    comments.forEach(record -> commentRepository.save(new Comment(record)));
  }
}
