package com.commerce.extobject.cli.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import com.commerce.extobject.cli.exception.OptionsValidationException;
import com.commerce.extobject.cli.model.SchemaOptions;
import com.commerce.extobject.cli.model.ValidatedSchemaOptions;
import com.commerce.extobject.schema.IndirectLookup;
import com.commerce.extobject.schema.TableSpec;

public class SchemaOptionsValidator {

	private static final Pattern API_NAME = Pattern.compile("^[A-Za-z][A-Za-z0-9_]*$");

	public ValidatedSchemaOptions validate(SchemaOptions o) {
		List<String> errors = new ArrayList<>();

		OptionChecks.requireReadableFile(o.getMappings(), "Mapping catalog", errors);

		if (OptionChecks.isBlank(o.getName())) {
			errors.add("Table name is required (--name / -n).");
		} else if (!API_NAME.matcher(o.getName()).matches()) {
			errors.add("Table name must start with a letter and contain only letters, digits and '_': " + o.getName());
		}

		if (OptionChecks.isBlank(o.getLookupColumn())) {
			errors.add("Lookup column is required (--lookup-column).");
		} else if (!API_NAME.matcher(o.getLookupColumn()).matches()) {
			errors.add("Lookup column must start with a letter and contain only letters, digits and '_': "
					+ o.getLookupColumn());
		}
		if (OptionChecks.isBlank(o.getLookupTarget())) {
			errors.add("Lookup target entity is required (--lookup-target).");
		}
		if (OptionChecks.isBlank(o.getLookupField())) {
			errors.add("Lookup target field is required (--lookup-field).");
		}

		OptionChecks.checkOutput(o.getOutput(), o.isForce(), errors);

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		String labelSingular = OptionChecks.isBlank(o.getLabelSingular()) ? o.getName() : o.getLabelSingular();
		String labelPlural = OptionChecks.isBlank(o.getLabelPlural()) ? labelSingular : o.getLabelPlural();

		TableSpec spec = TableSpec.builder()
				.name(o.getName())
				.labelSingular(labelSingular)
				.labelPlural(labelPlural)
				.description(o.getDescription() == null ? "" : o.getDescription())
				.lookup(IndirectLookup.builder()
						.columnName(o.getLookupColumn())
						.label(OptionChecks.isBlank(o.getLookupLabel()) ? o.getLookupColumn() : o.getLookupLabel())
						.description(o.getLookupDescription() == null ? "" : o.getLookupDescription())
						.targetEntity(o.getLookupTarget())
						.targetField(o.getLookupField())
						.build())
				.build();

		return new ValidatedSchemaOptions(OptionChecks.normalize(o.getMappings()), spec,
				o.getOutput() == null ? null : OptionChecks.normalize(o.getOutput()));
	}
}
