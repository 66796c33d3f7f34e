package dev.vidcrawl.store;

import java.util.List;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Merges user profiles by username; a stored profile is replaced wholesale. */
@Service
public class UserInfoUpsertService {

  private final UserInfoRepository userInfoRepository;

  public UserInfoUpsertService(UserInfoRepository userInfoRepository) {
    this.userInfoRepository = userInfoRepository;
  }

  @Transactional
  public void upsert(List<UserInfoRecord> userInfos) {
    userInfos.forEach(record -> userInfoRepository.save(new UserInfo(record)));
  }
}
