package quest.gekko.dataflag.web.dto;

import quest.gekko.dataflag.domain.DataFlag;

import java.util.Map;

public record FlagDTO(Long id, String type, double startTime, Double finishTime, Map<String, Object> metadata) {

    public static FlagDTO from(DataFlag flag) {
        return new FlagDTO(flag.getId(), flag.getType().getName(), flag.getStartTime(), flag.getFinishTime(),
                flag.getMetadata());
    }
}
