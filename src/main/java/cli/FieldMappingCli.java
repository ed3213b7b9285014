package cli;

import app.FieldMappingCliApp;

/**
 * CLI entrypoint facade.
 *
 * <p>옵션 처리와 조립은 {@link FieldMappingCliApp} 에 있다.</p>
 */
public class FieldMappingCli {

    public static void main(String[] args) {
        System.exit(FieldMappingCliApp.run(args));
    }
}
