package civiltime.datetime;

import lombok.Getter;

@Getter
public class FormatDirectiveException extends IllegalArgumentException {

    private final String template;
    private final String directive;

    public FormatDirectiveException(String template, String directive) {
        super(String.format("Unknown directive \"%s\" in template \"%s\"", directive, template));
        this.template = template;
        this.directive = directive;
    }

}
