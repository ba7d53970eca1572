package quest.gekko.dataflag.web.dto;

import quest.gekko.dataflag.domain.DataFlag;

/**
 * Dense views of a flag: {@code true} where the flag applies. {@code inputMask} is null for flags
 * not tied to an instrument.
 */
public record FlagMaskDTO(Long id, boolean[] freqMask, boolean[] inputMask) {

    public static FlagMaskDTO from(DataFlag flag) {
        return new FlagMaskDTO(flag.getId(), flag.freqMask(), flag.inputMask());
    }
}
