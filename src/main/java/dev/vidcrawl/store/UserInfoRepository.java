package dev.vidcrawl.store;

import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link UserInfo} entities. */
public interface UserInfoRepository extends JpaRepository<UserInfo, String> {}
