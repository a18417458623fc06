package org.janelia.atlasreg.registration;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import org.janelia.atlasreg.model.AtlasSpec;

/**
 * Ordered registration steps from the sample towards the root atlas. The fixed level of a step is the moving level
 * of the next one.
 */
public class RegistrationChain {

    private final List<RegistrationStep> steps;

    public RegistrationChain(List<RegistrationStep> steps) {
        Preconditions.checkArgument(!steps.isEmpty(), "A registration chain needs at least one step");
        for (int i = 1; i < steps.size(); i++) {
            Preconditions.checkArgument(steps.get(i).getMoving().getId().equals(steps.get(i - 1).getFixed().getId()),
                    "Step %s does not start from the level where step %s ends", i, i - 1);
        }
        this.steps = ImmutableList.copyOf(steps);
    }

    /**
     * @return steps in source to atlas order
     */
    public List<RegistrationStep> getSteps() {
        return steps;
    }

    /**
     * @return a reversed view of the steps, atlas to source
     */
    public List<RegistrationStep> reversed() {
        return Lists.reverse(steps);
    }

    public RegistrationStep getStep(int index) {
        return steps.get(index);
    }

    public int size() {
        return steps.size();
    }

    public AtlasSpec getSource() {
        return steps.get(0).getMoving();
    }

    public AtlasSpec getFinalTarget() {
        return steps.get(steps.size() - 1).getFixed();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(getSource().getId());
        steps.forEach(s -> sb.append(" -> ").append(s.getFixed().getId()));
        return sb.toString();
    }
}
