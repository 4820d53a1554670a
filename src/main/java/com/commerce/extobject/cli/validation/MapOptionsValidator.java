package com.commerce.extobject.cli.validation;

import java.util.ArrayList;
import java.util.List;

import com.commerce.extobject.cli.exception.OptionsValidationException;
import com.commerce.extobject.cli.model.MapOptions;
import com.commerce.extobject.cli.model.ValidatedMapOptions;

public class MapOptionsValidator {

	public ValidatedMapOptions validate(MapOptions o) {
		List<String> errors = new ArrayList<>();

		OptionChecks.requireReadableFile(o.getMappings(), "Mapping catalog", errors);
		OptionChecks.requireReadableFile(o.getDocument(), "Source document", errors);
		OptionChecks.checkOutput(o.getOutput(), o.isForce(), errors);

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		String context = OptionChecks.isBlank(o.getContext())
				? o.getDocument().getFileName().toString()
				: o.getContext().trim();

		return new ValidatedMapOptions(OptionChecks.normalize(o.getMappings()),
				OptionChecks.normalize(o.getDocument()), context,
				o.getOutput() == null ? null : OptionChecks.normalize(o.getOutput()));
	}
}
