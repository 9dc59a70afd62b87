package com.ids.authgate.security.directory;

import com.ids.authgate.security.exception.RoleNotFoundException;
import com.ids.authgate.security.exception.UserNotFoundException;
import com.ids.authgate.security.model.Role;
import com.ids.authgate.security.model.UserAccount;
import com.ids.authgate.security.model.UserCriteria;

/**
 * 사용자와 역할을 조회하고 저장하는 저장소 추상화입니다.
 * <p>
 * 실제 저장 방식(JPA, JDBC, 외부 디렉터리 등)은 애플리케이션이 구현합니다.
 * 애플리케이션이 구현체를 등록하지 않으면 {@link InMemoryUserDirectory}가 사용됩니다.
 * </p>
 */
public interface UserDirectory {

    /**
     * 조건에 맞는 사용자를 조회합니다.
     *
     * @throws UserNotFoundException 조건에 맞는 사용자가 없는 경우
     */
    UserAccount findUser(UserCriteria criteria);

    /**
     * 이름으로 역할을 조회합니다.
     *
     * @throws RoleNotFoundException 해당 이름의 역할이 없는 경우
     */
    Role findRole(String name);

    UserAccount persist(UserAccount user);

    Role persist(Role role);

    void delete(UserAccount user);

    /**
     * 조건에 맞는 사용자가 존재하는지 확인합니다.
     */
    default boolean exists(UserCriteria criteria) {
        try {
            findUser(criteria);
            return true;
        } catch (UserNotFoundException e) {
            return false;
        }
    }
}
