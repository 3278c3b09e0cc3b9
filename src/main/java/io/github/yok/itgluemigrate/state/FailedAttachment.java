package io.github.yok.itgluemigrate.state;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Failure record of one attachment upload.
 *
 * @author Yasuharu.Okawauchi
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FailedAttachment {

    private String filename;

    private String error;

    private String timestamp;
}
