package quest.gekko.dataflag.web.dto;

import quest.gekko.dataflag.domain.DataFlagUser;

public record UserDTO(Long id, String userName) {

    public static UserDTO from(DataFlagUser user) {
        return new UserDTO(user.getId(), user.getUserName());
    }
}
