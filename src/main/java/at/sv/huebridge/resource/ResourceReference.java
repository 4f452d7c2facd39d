package at.sv.huebridge.resource;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@AllArgsConstructor
@NoArgsConstructor
@Data
public final class ResourceReference {
    private String rid;
    private String rtype;
}
