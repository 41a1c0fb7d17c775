package im.arun.provisiongraph.classify;

import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor
public class ClassifiedBlock {
    BlockType type;
    String text;
}
