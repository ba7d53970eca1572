package quest.gekko.dataflag.web.dto;

import quest.gekko.dataflag.domain.DataRevision;

public record RevisionDTO(Long id, String name, String description) {

    public static RevisionDTO from(DataRevision revision) {
        return new RevisionDTO(revision.getId(), revision.getName(), revision.getDescription());
    }
}
